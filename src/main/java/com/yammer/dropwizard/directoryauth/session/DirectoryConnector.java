package com.yammer.dropwizard.directoryauth.session;

import javax.naming.NamingException;

public interface DirectoryConnector {

	/**
	 * Opens a fresh connection to the directory and binds it.
	 *
	 * @throws javax.naming.AuthenticationException if the directory rejects the credentials
	 * @throws NamingException on any transport failure
	 */
	DirectoryConnection connect(BindCredentials credentials) throws NamingException;

}
