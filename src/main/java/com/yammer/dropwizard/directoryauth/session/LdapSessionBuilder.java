package com.yammer.dropwizard.directoryauth.session;

import java.util.Hashtable;

import javax.naming.Context;
import javax.naming.NamingException;

import com.google.common.annotations.VisibleForTesting;
import com.yammer.dropwizard.directoryauth.DirectoryConfiguration;
import com.yammer.dropwizard.directoryauth.EncryptionMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Opens JNDI connections to the configured directory server. Every call to {@link #connect(BindCredentials)} gets a
 * new, unpooled connection.
 */
public class LdapSessionBuilder implements DirectoryConnector {
	private static final Logger LOG = LoggerFactory.getLogger(LdapSessionBuilder.class);
	static final String LDAP_CONTEXT_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";
	static final String SOCKET_FACTORY_PROPERTY = "java.naming.ldap.factory.socket";

	private final String providerUrl;
	private final EncryptionMode encryption;
	private final boolean validateCertificates;
	private final long timeoutMillis;

	public LdapSessionBuilder(DirectoryConfiguration configuration) {
		checkNotNull(configuration);
		this.encryption = checkNotNull(configuration.getEncryption());
		this.providerUrl = providerUrl(encryption, configuration.getServer(), configuration.getPort());
		this.validateCertificates = configuration.isValidateCertificates();
		this.timeoutMillis = configuration.getTimeout().toMilliseconds();
	}

	private static String providerUrl(EncryptionMode encryption, String server, int port) {
		final String scheme = encryption == EncryptionMode.LDAPS ? "ldaps" : "ldap";
		final String host = server.indexOf(':') >= 0 && !server.startsWith("[") ? "[" + server + "]" : server;
		return String.format("%s://%s:%d", scheme, host, port);
	}

	public String getProviderUrl() {
		return providerUrl;
	}

	@Override
	public DirectoryConnection connect(BindCredentials credentials) throws NamingException {
		LOG.debug("Connecting to {} as {}", providerUrl, credentials);
		return new AutoclosingLdapContext(environmentFor(credentials), validateCertificates);
	}

	@VisibleForTesting
	Hashtable<String, String> environmentFor(BindCredentials credentials) {
		final Hashtable<String, String> env = contextConfiguration();
		if (credentials.isAnonymous()) {
			env.put(Context.SECURITY_AUTHENTICATION, "none");
		} else {
			env.put(Context.SECURITY_AUTHENTICATION, "simple");
			env.put(Context.SECURITY_PRINCIPAL, credentials.getPrincipal());
			env.put(Context.SECURITY_CREDENTIALS, credentials.getPassword());
		}
		return env;
	}

	private Hashtable<String, String> contextConfiguration() {
		final Hashtable<String, String> env = new Hashtable<>();

		env.put(Context.INITIAL_CONTEXT_FACTORY, LDAP_CONTEXT_FACTORY);
		env.put(Context.PROVIDER_URL, providerUrl);
		env.put(Context.REFERRAL, "ignore");
		env.put("com.sun.jndi.ldap.connect.timeout", String.valueOf(timeoutMillis));
		env.put("com.sun.jndi.ldap.read.timeout", String.valueOf(timeoutMillis));
		env.put("com.sun.jndi.ldap.connect.pool", "false");

		if (encryption == EncryptionMode.LDAPS) {
			env.put(Context.SECURITY_PROTOCOL, "ssl");
			if (!validateCertificates) {
				env.put(SOCKET_FACTORY_PROPERTY, TrustAllSocketFactory.class.getName());
			}
		}

		return env;
	}
}
