package com.yammer.dropwizard.directoryauth.session;

import javax.naming.ldap.Rdn;

import com.google.common.base.MoreObjects;
import com.yammer.dropwizard.directoryauth.DirectoryConfiguration;

import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.util.security.Password;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * How a connection gets bound, fixed once per configuration: which naming scheme the bind principal follows and
 * whose credentials are presented.
 */
public final class BindStrategy {

    public enum Mechanism {
        /** Account name (down-level {@code DOMAIN\\user} or UPN) bound against Active Directory. */
        ACTIVE_DIRECTORY,
        /** {@code <usernameAttribute>=<name>,<baseDn>}. */
        STANDARD
    }

    public enum Identity {
        SERVICE_ACCOUNT,
        END_USER,
        ANONYMOUS
    }

    private static final String OBFUSCATED_PREFIX = "OBF:";

    private final Mechanism mechanism;
    private final Identity identity;
    private final String usernameAttribute;
    private final String baseDn;
    private final String activeDirectoryDomain;
    private final String serviceUsername;
    private final String servicePassword;

    private BindStrategy(Mechanism mechanism, Identity identity, String usernameAttribute, String baseDn,
                         String activeDirectoryDomain, String serviceUsername, String servicePassword) {
        this.mechanism = mechanism;
        this.identity = identity;
        this.usernameAttribute = usernameAttribute;
        this.baseDn = baseDn;
        this.activeDirectoryDomain = activeDirectoryDomain;
        this.serviceUsername = serviceUsername;
        this.servicePassword = servicePassword;
    }

    public static BindStrategy from(DirectoryConfiguration configuration) {
        checkNotNull(configuration);
        final Mechanism mechanism = configuration.isActiveDirectory() ? Mechanism.ACTIVE_DIRECTORY : Mechanism.STANDARD;
        if (configuration.isBindAsServiceAccount()) {
            checkArgument(StringUtils.isNotEmpty(configuration.getBindUsername()),
                    "bindUsername is required when binding as a service account");
            checkArgument(StringUtils.isNotEmpty(configuration.getBindPassword()),
                    "bindPassword is required when binding as a service account");
            return new BindStrategy(mechanism, Identity.SERVICE_ACCOUNT, configuration.getUsernameAttribute(),
                    configuration.getBaseDn(), configuration.getActiveDirectoryDomain(),
                    configuration.getBindUsername(), deobfuscate(configuration.getBindPassword()));
        }
        return new BindStrategy(mechanism, Identity.END_USER, configuration.getUsernameAttribute(),
                configuration.getBaseDn(), configuration.getActiveDirectoryDomain(), null, null);
    }

    private static String deobfuscate(String password) {
        return password.startsWith(OBFUSCATED_PREFIX) ? Password.deobfuscate(password) : password;
    }

    public Mechanism getMechanism() {
        return mechanism;
    }

    public Identity getIdentity() {
        return identity;
    }

    public boolean isServiceAccount() {
        return identity == Identity.SERVICE_ACCOUNT;
    }

    /**
     * Credentials for the initial bind of an authentication attempt for the given end user.
     */
    public BindCredentials credentialsFor(String username, String password) {
        if (isServiceAccount()) {
            return new BindCredentials(Identity.SERVICE_ACCOUNT, principalFor(serviceUsername), servicePassword);
        }
        return new BindCredentials(Identity.END_USER, principalFor(username), password);
    }

    /**
     * Credentials to check a directory connection without an end user at hand.
     */
    public BindCredentials probeCredentials() {
        if (isServiceAccount()) {
            return credentialsFor(null, null);
        }
        return BindCredentials.anonymous();
    }

    String principalFor(String bindUsername) {
        if (mechanism == Mechanism.ACTIVE_DIRECTORY) {
            if (StringUtils.isEmpty(activeDirectoryDomain) || StringUtils.containsAny(bindUsername, '@', '\\')) {
                return bindUsername;
            }
            return bindUsername + "@" + activeDirectoryDomain;
        }
        return String.format("%s=%s,%s", usernameAttribute, Rdn.escapeValue(bindUsername), baseDn);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("mechanism", mechanism)
                .add("identity", identity)
                .add("serviceUsername", serviceUsername)
                .toString();
    }
}
