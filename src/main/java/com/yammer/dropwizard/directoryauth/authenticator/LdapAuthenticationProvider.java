package com.yammer.dropwizard.directoryauth.authenticator;

public interface LdapAuthenticationProvider {

	/**
	 * @return {@code true} if a connection to the directory can be opened and bound
	 */
	boolean canAuthenticate();

	AuthenticationOutcome authenticate(AuthnRequest request);

}
