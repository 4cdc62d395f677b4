package com.yammer.dropwizard.directoryauth.authenticator;

import java.util.Optional;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of one authentication attempt: either the identity found in the directory or the reason it failed.
 */
public final class AuthenticationOutcome {
	private final DirectoryIdentity identity;
	private final AuthFailure failure;
	private final String detail;

	private AuthenticationOutcome(DirectoryIdentity identity, AuthFailure failure, String detail) {
		this.identity = identity;
		this.failure = failure;
		this.detail = detail;
	}

	public static AuthenticationOutcome success(DirectoryIdentity identity) {
		return new AuthenticationOutcome(checkNotNull(identity), null, null);
	}

	public static AuthenticationOutcome failure(AuthFailure failure, String detail) {
		return new AuthenticationOutcome(null, checkNotNull(failure), detail);
	}

	public boolean isSuccess() {
		return identity != null;
	}

	public Optional<DirectoryIdentity> getIdentity() {
		return Optional.ofNullable(identity);
	}

	public Optional<AuthFailure> getFailure() {
		return Optional.ofNullable(failure);
	}

	/**
	 * @return a human readable explanation of the failure, suitable for logs but not for end users
	 */
	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.omitNullValues()
				.add("identity", identity)
				.add("failure", failure)
				.add("detail", detail)
				.toString();
	}
}
