package com.yammer.dropwizard.directoryauth.authenticator;

public enum AuthFailure {
	/** Connection, TLS or network fault unrelated to the presented credentials. */
	TRANSPORT_FAILURE,
	/** The directory rejected a bind. */
	INVALID_CREDENTIALS,
	/** The person search came back empty or timed out. */
	DIRECTORY_QUERY_FAILURE,
	/** The entry is not a member of any allowed group. */
	GROUP_MEMBERSHIP_DENIED
}
