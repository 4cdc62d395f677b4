package com.yammer.dropwizard.directoryauth.session;

import java.util.Optional;

import javax.naming.NamingException;

/**
 * A bound connection to the directory. Instances are used by a single authentication attempt and then closed.
 */
public interface DirectoryConnection extends AutoCloseable {

	/**
	 * Upgrades the connection in place with the StartTLS extended operation.
	 */
	void startTls() throws NamingException;

	/**
	 * @return the first entry matching the search, if any
	 * @throws javax.naming.TimeLimitExceededException if the directory gave up before answering
	 */
	Optional<DirectoryEntry> searchFirst(DirectorySearch search) throws NamingException;

	/**
	 * Binds the connection again under another identity.
	 *
	 * @throws javax.naming.AuthenticationException if the directory rejects the credentials
	 */
	void rebind(String principal, String password) throws NamingException;

	@Override
	void close() throws NamingException;

}
