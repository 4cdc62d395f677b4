package com.yammer.dropwizard.directoryauth.authenticator;

import java.net.SocketTimeoutException;
import java.util.Optional;

import javax.naming.CommunicationException;
import javax.naming.NamingException;
import javax.naming.NamingSecurityException;
import javax.naming.ServiceUnavailableException;
import javax.naming.TimeLimitExceededException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.yammer.dropwizard.directoryauth.DirectoryConfiguration;
import com.yammer.dropwizard.directoryauth.EncryptionMode;
import com.yammer.dropwizard.directoryauth.session.BindCredentials;
import com.yammer.dropwizard.directoryauth.session.BindStrategy;
import com.yammer.dropwizard.directoryauth.session.DirectoryConnection;
import com.yammer.dropwizard.directoryauth.session.DirectoryConnector;
import com.yammer.dropwizard.directoryauth.session.DirectoryEntry;
import com.yammer.dropwizard.directoryauth.session.DirectorySearch;
import com.yammer.dropwizard.directoryauth.session.LdapFilters;
import com.yammer.dropwizard.directoryauth.session.LdapSessionBuilder;
import io.dropwizard.util.Duration;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binds, looks the user up beneath the base DN, applies the group allow-list and, when the first bind used the
 * service account, re-binds as the user to verify the password. Each call uses its own connection; instances hold
 * only the configuration snapshot taken at construction and are safe to share between threads.
 */
public class LdapSearchingAuthenticator implements LdapAuthenticationProvider {
	private static final Logger LOG = LoggerFactory.getLogger(LdapSearchingAuthenticator.class);

	private final DirectoryConnector connector;
	private final BindStrategy bindStrategy;
	private final EncryptionMode encryption;
	private final String baseDn;
	private final boolean activeDirectory;
	private final String accountNameAttribute;
	private final String displayNameAttribute;
	private final String groupMembershipAttribute;
	private final Duration timeout;
	private final AllowedGroups allowedGroups;

	public LdapSearchingAuthenticator(DirectoryConfiguration configuration) {
		this(configuration, new LdapSessionBuilder(configuration));
	}

	public LdapSearchingAuthenticator(DirectoryConfiguration configuration, DirectoryConnector connector) {
		checkNotNull(configuration);
		this.connector = checkNotNull(connector);
		this.bindStrategy = BindStrategy.from(configuration);
		this.encryption = checkNotNull(configuration.getEncryption());
		this.baseDn = checkNotNull(configuration.getBaseDn());
		this.activeDirectory = configuration.isActiveDirectory();
		this.accountNameAttribute = configuration.getAccountNameAttribute();
		this.displayNameAttribute = configuration.getDisplayNameAttribute();
		this.groupMembershipAttribute = configuration.getGroupMembershipAttribute();
		this.timeout = checkNotNull(configuration.getTimeout());
		this.allowedGroups = new AllowedGroups(configuration.getAllowedGroupDns());
	}

	@Override
	public boolean canAuthenticate() {
		final BindCredentials credentials = bindStrategy.probeCredentials();
		try (DirectoryConnection connection = connector.connect(credentials)) {
			if (encryption == EncryptionMode.STARTTLS) {
				connection.startTls();
			}
			return true;
		} catch (NamingException err) {
			LOG.warn("Unable to bind to the directory as {}: {}", credentials.getIdentity(), err.toString());
		}
		return false;
	}

	@Override
	public AuthenticationOutcome authenticate(AuthnRequest request) {
		checkNotNull(request);
		final String username = request.getUsername();
		if (StringUtils.isEmpty(username) || StringUtils.isEmpty(request.getPassword())) {
			// an empty simple bind password is an unauthenticated bind and would always succeed
			LOG.debug("Rejecting login with empty username or password");
			return AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS,
					"Username and password must not be empty");
		}

		final BindCredentials credentials = bindStrategy.credentialsFor(username, request.getPassword());
		final DirectoryConnection connection;
		try {
			connection = connector.connect(credentials);
		} catch (NamingSecurityException e) {
			return bindRejected(credentials, username, e);
		} catch (NamingException e) {
			return transportFailure(username, "bind", e);
		}

		try {
			return authenticate(connection, request);
		} finally {
			close(connection);
		}
	}

	private AuthenticationOutcome authenticate(DirectoryConnection connection, AuthnRequest request) {
		final String username = request.getUsername();

		// TLS comes up only after the bind above
		if (encryption == EncryptionMode.STARTTLS) {
			try {
				connection.startTls();
			} catch (NamingException e) {
				return transportFailure(username, "StartTLS", e);
			}
		}

		final Optional<DirectoryEntry> found;
		try {
			found = connection.searchFirst(searchFor(username));
		} catch (TimeLimitExceededException e) {
			LOG.error("LDAP search for {} timed out after {}", username, timeout);
			return AuthenticationOutcome.failure(AuthFailure.DIRECTORY_QUERY_FAILURE,
					String.format("Search for %s timed out", username));
		} catch (NamingException e) {
			return transportFailure(username, "search", e);
		}
		if (!found.isPresent()) {
			LOG.error("LDAP search for {} returned no results", username);
			return AuthenticationOutcome.failure(AuthFailure.DIRECTORY_QUERY_FAILURE,
					String.format("No person entry found for %s", username));
		}

		final DirectoryEntry entry = found.get();
		final Optional<String> accountName = entry.getFirstValue(accountNameAttribute);
		if (!accountName.isPresent()) {
			LOG.error("Entry {} has no {} attribute", entry.getDn(), accountNameAttribute);
			return AuthenticationOutcome.failure(AuthFailure.DIRECTORY_QUERY_FAILURE,
					String.format("Entry %s has no %s attribute", entry.getDn(), accountNameAttribute));
		}
		final String uid = accountName.get();
		final String displayName = entry.getFirstValue(displayNameAttribute).orElse(uid);
		LOG.info("Found user {} ({})", displayName, uid);

		final ImmutableList<String> memberOf = entry.getValues(groupMembershipAttribute);
		if (allowedGroups.isRestricted()) {
			LOG.debug("Checking if user is a member of any of the following groups: {}", allowedGroups);
			LOG.info("User {} is member of {}", uid, memberOf);
			if (!allowedGroups.permits(memberOf)) {
				final String detail = String.format("User %s is not a member of any of the required groups", uid);
				LOG.warn(detail);
				return AuthenticationOutcome.failure(AuthFailure.GROUP_MEMBERSHIP_DENIED, detail);
			}
		}

		if (bindStrategy.isServiceAccount()) {
			try {
				connection.rebind(entry.getDn(), request.getPassword());
			} catch (NamingSecurityException e) {
				LOG.warn("Bind as {} failed: {}", entry.getDn(), e.getExplanation());
				return AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS,
						"Invalid LDAP credentials provided");
			} catch (NamingException e) {
				return transportFailure(username, "rebind", e);
			}
		}

		return AuthenticationOutcome.success(
				new DirectoryIdentity(uid, displayName, entry.getDn(), ImmutableSet.copyOf(memberOf)));
	}

	private DirectorySearch searchFor(String username) {
		final String accountName = activeDirectory ? LdapFilters.accountName(username) : username;
		return new DirectorySearch(baseDn, LdapFilters.personWithAttribute(accountNameAttribute, accountName),
				ImmutableList.of(accountNameAttribute, displayNameAttribute, groupMembershipAttribute), timeout);
	}

	private static AuthenticationOutcome bindRejected(BindCredentials credentials, String username,
			NamingSecurityException e) {
		if (credentials.getIdentity() == BindStrategy.Identity.SERVICE_ACCOUNT) {
			LOG.error("Service account bind as {} rejected while authenticating {}: {}",
					credentials.getPrincipal(), username, e.getExplanation());
		} else {
			LOG.warn("Bind failed for {}: {}", credentials.getPrincipal(), e.getExplanation());
		}
		return AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS, "Invalid LDAP credentials provided");
	}

	private static AuthenticationOutcome transportFailure(String username, String phase, NamingException e) {
		LOG.warn("LDAP {} failed for {} ({}): {}", phase, username, faultKind(e), e.toString());
		return AuthenticationOutcome.failure(AuthFailure.TRANSPORT_FAILURE,
				String.format("LDAP %s failure (username: %s)", phase, username));
	}

	private static String faultKind(NamingException e) {
		if (e.getRootCause() instanceof SocketTimeoutException
				|| StringUtils.containsIgnoreCase(e.getExplanation(), "timed out")) {
			return "timeout";
		}
		if (e instanceof CommunicationException || e instanceof ServiceUnavailableException) {
			return "network";
		}
		return "directory";
	}

	private static void close(DirectoryConnection connection) {
		try {
			connection.close();
		} catch (NamingException e) {
			LOG.debug("Failed to close directory connection", e);
		}
	}
}
