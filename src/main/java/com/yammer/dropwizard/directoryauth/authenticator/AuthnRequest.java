package com.yammer.dropwizard.directoryauth.authenticator;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Username and password exactly as the user typed them. Never logged, never stored.
 */
public final class AuthnRequest {
	private final String username;
	private final String password;

	public AuthnRequest(String username, String password) {
		this.username = checkNotNull(username);
		this.password = checkNotNull(password);
	}

	public String getUsername() {
		return username;
	}

	public String getPassword() {
		return password;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("username", username).toString();
	}
}
