package com.yammer.dropwizard.directoryauth;

import java.util.Set;
import java.util.concurrent.TimeUnit;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import io.dropwizard.util.Duration;
import io.dropwizard.validation.MinDuration;
import io.dropwizard.validation.ValidationMethod;

import org.apache.commons.lang3.StringUtils;

public class DirectoryConfiguration extends AuthProviderConfiguration {
    public static final String TYPE = "ldap";
    public static final String ACTIVE_DIRECTORY_USERNAME_ATTRIBUTE = "sAMAccountName";

    @NotEmpty
    @JsonProperty
    private String server;

    @Min(1)
    @Max(65535)
    @JsonProperty
    private int port = 636;

    @NotNull
    @JsonProperty
    private EncryptionMode encryption = EncryptionMode.LDAPS;

    @JsonProperty
    private boolean validateCertificates = true;

    @NotNull
    @MinDuration(value = 1, unit = TimeUnit.SECONDS)
    @JsonProperty
    private Duration timeout = Duration.seconds(10);

    @NotEmpty
    @JsonProperty
    private String baseDn;

    @NotEmpty
    @JsonProperty
    private String usernameAttribute = "uid";

    @NotEmpty
    @JsonProperty
    private String displayNameAttribute = "displayName";

    @NotEmpty
    @JsonProperty
    private String groupMembershipAttribute = "memberOf";

    @JsonProperty
    private boolean activeDirectory = false;

    @JsonProperty
    private String activeDirectoryDomain;

    @JsonProperty
    private boolean bindAsServiceAccount = true;

    @JsonProperty
    private String bindUsername;

    @JsonProperty
    private String bindPassword;

    @NotNull
    @JsonProperty
    private Set<@NotEmpty String> allowedGroupDns = ImmutableSet.of();

    public DirectoryConfiguration() {
        super(TYPE);
    }

    public String getServer() {
        return server;
    }

    public DirectoryConfiguration setServer(String server) {
        this.server = server;
        return this;
    }

    public int getPort() {
        return port;
    }

    public DirectoryConfiguration setPort(int port) {
        this.port = port;
        return this;
    }

    public EncryptionMode getEncryption() {
        return encryption;
    }

    public DirectoryConfiguration setEncryption(EncryptionMode encryption) {
        this.encryption = encryption;
        return this;
    }

    public boolean isValidateCertificates() {
        return validateCertificates;
    }

    public DirectoryConfiguration setValidateCertificates(boolean validateCertificates) {
        this.validateCertificates = validateCertificates;
        return this;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @JsonIgnore
    public DirectoryConfiguration setTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * Accepts a Dropwizard duration such as {@code 5 seconds}, or a bare number of seconds.
     */
    @JsonProperty("timeout")
    private void setTimeoutSetting(String timeout) {
        if (timeout == null) {
            this.timeout = null;
        } else if (StringUtils.isNumeric(timeout)) {
            this.timeout = Duration.seconds(Long.parseLong(timeout));
        } else {
            this.timeout = Duration.parse(timeout);
        }
    }

    public String getBaseDn() {
        return baseDn;
    }

    public DirectoryConfiguration setBaseDn(String baseDn) {
        this.baseDn = baseDn;
        return this;
    }

    public String getUsernameAttribute() {
        return usernameAttribute;
    }

    public DirectoryConfiguration setUsernameAttribute(String usernameAttribute) {
        this.usernameAttribute = usernameAttribute;
        return this;
    }

    public String getDisplayNameAttribute() {
        return displayNameAttribute;
    }

    public DirectoryConfiguration setDisplayNameAttribute(String displayNameAttribute) {
        this.displayNameAttribute = displayNameAttribute;
        return this;
    }

    public String getGroupMembershipAttribute() {
        return groupMembershipAttribute;
    }

    public DirectoryConfiguration setGroupMembershipAttribute(String groupMembershipAttribute) {
        this.groupMembershipAttribute = groupMembershipAttribute;
        return this;
    }

    public boolean isActiveDirectory() {
        return activeDirectory;
    }

    public DirectoryConfiguration setActiveDirectory(boolean activeDirectory) {
        this.activeDirectory = activeDirectory;
        return this;
    }

    public String getActiveDirectoryDomain() {
        return activeDirectoryDomain;
    }

    public DirectoryConfiguration setActiveDirectoryDomain(String activeDirectoryDomain) {
        this.activeDirectoryDomain = activeDirectoryDomain;
        return this;
    }

    public boolean isBindAsServiceAccount() {
        return bindAsServiceAccount;
    }

    public DirectoryConfiguration setBindAsServiceAccount(boolean bindAsServiceAccount) {
        this.bindAsServiceAccount = bindAsServiceAccount;
        return this;
    }

    public String getBindUsername() {
        return bindUsername;
    }

    public DirectoryConfiguration setBindUsername(String bindUsername) {
        this.bindUsername = bindUsername;
        return this;
    }

    public String getBindPassword() {
        return bindPassword;
    }

    /**
     * @param bindPassword the service account password, either in clear or obfuscated with Jetty's {@code OBF:} scheme
     */
    public DirectoryConfiguration setBindPassword(String bindPassword) {
        this.bindPassword = bindPassword;
        return this;
    }

    public Set<String> getAllowedGroupDns() {
        return allowedGroupDns;
    }

    public DirectoryConfiguration setAllowedGroupDns(Set<String> allowedGroupDns) {
        this.allowedGroupDns = allowedGroupDns;
        return this;
    }

    /**
     * The attribute holding the account name: {@code sAMAccountName} for Active Directory, the configured username
     * attribute otherwise.
     */
    @JsonIgnore
    public String getAccountNameAttribute() {
        return activeDirectory ? ACTIVE_DIRECTORY_USERNAME_ATTRIBUTE : usernameAttribute;
    }

    @JsonIgnore
    @ValidationMethod(message = "bindUsername and bindPassword are required when bindAsServiceAccount is enabled")
    public boolean isServiceAccountComplete() {
        return !bindAsServiceAccount
                || (StringUtils.isNotEmpty(bindUsername) && StringUtils.isNotEmpty(bindPassword));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", getType())
                .add("id", getId())
                .add("server", server)
                .add("port", port)
                .add("encryption", encryption)
                .add("validateCertificates", validateCertificates)
                .add("timeout", timeout)
                .add("baseDn", baseDn)
                .add("accountNameAttribute", getAccountNameAttribute())
                .add("bindAsServiceAccount", bindAsServiceAccount)
                .add("bindUsername", bindUsername)
                .add("allowedGroupDns", allowedGroupDns)
                .toString();
    }
}
