package com.yammer.dropwizard.directoryauth.session;

import java.io.IOException;
import java.util.Hashtable;
import java.util.Optional;

import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.StartTlsRequest;
import javax.naming.ldap.StartTlsResponse;

import com.google.common.collect.ImmutableListMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * JNDI backed {@link DirectoryConnection}. Creating the context performs the initial bind.
 */
public class AutoclosingLdapContext implements DirectoryConnection {
	private static final Logger LOG = LoggerFactory.getLogger(AutoclosingLdapContext.class);

	private final InitialLdapContext context;
	private final boolean validateCertificates;
	private StartTlsResponse tls;

	public AutoclosingLdapContext(Hashtable<String, String> environment, boolean validateCertificates)
			throws NamingException {
		this.context = new InitialLdapContext(environment, null);
		this.validateCertificates = validateCertificates;
	}

	@Override
	public void startTls() throws NamingException {
		checkState(tls == null, "StartTLS already negotiated");
		final StartTlsResponse response = (StartTlsResponse) context.extendedOperation(new StartTlsRequest());
		try {
			if (validateCertificates) {
				response.negotiate();
			} else {
				response.setHostnameVerifier((hostname, session) -> true);
				response.negotiate(TrustAllSocketFactory.getInstance());
			}
		} catch (IOException e) {
			final NamingException ne = new CommunicationException("Failed to negotiate StartTLS");
			ne.setRootCause(e);
			throw ne;
		}
		tls = response;
		LOG.debug("StartTLS negotiated");
	}

	@Override
	public Optional<DirectoryEntry> searchFirst(DirectorySearch search) throws NamingException {
		final String[] attributes = search.getAttributes().toArray(new String[0]);
		final SearchControls controls = new SearchControls(SearchControls.SUBTREE_SCOPE, 1,
				(int) search.getTimeLimit().toMilliseconds(), attributes, false, false);
		final NamingEnumeration<SearchResult> result = context.search(search.getBaseDn(), search.getFilter(),
				controls);
		try {
			if (!result.hasMore()) {
				return Optional.empty();
			}
			final SearchResult next = result.next();
			return Optional.of(toEntry(next, attributes));
		} finally {
			result.close();
		}
	}

	private static DirectoryEntry toEntry(SearchResult result, String[] requested) throws NamingException {
		final ImmutableListMultimap.Builder<String, String> values = ImmutableListMultimap.builder();
		final Attributes attributes = result.getAttributes();
		if (attributes != null) {
			for (String name : requested) {
				final Attribute attribute = attributes.get(name);
				if (attribute == null) {
					continue;
				}
				final NamingEnumeration<?> all = attribute.getAll();
				try {
					while (all.hasMore()) {
						final Object value = all.next();
						if (value != null) {
							values.put(name, value.toString());
						}
					}
				} finally {
					all.close();
				}
			}
		}
		return new DirectoryEntry(result.getNameInNamespace(), values.build());
	}

	@Override
	public void rebind(String principal, String password) throws NamingException {
		context.addToEnvironment(Context.SECURITY_AUTHENTICATION, "simple");
		context.addToEnvironment(Context.SECURITY_PRINCIPAL, principal);
		context.addToEnvironment(Context.SECURITY_CREDENTIALS, password);
		context.reconnect(null);
	}

	@Override
	public void close() throws NamingException {
		try {
			if (tls != null) {
				tls.close();
			}
		} catch (IOException e) {
			LOG.debug("Failed to close TLS layer cleanly", e);
		} finally {
			context.close();
		}
	}
}
