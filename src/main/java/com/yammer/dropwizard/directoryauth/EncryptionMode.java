package com.yammer.dropwizard.directoryauth;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EncryptionMode {
	@JsonProperty("none")
	NONE,

	@JsonProperty("ldaps")
	LDAPS,

	/**
	 * Plaintext connection upgraded with the StartTLS extended operation once the initial bind has succeeded.
	 * The bind credentials therefore cross the wire unencrypted.
	 */
	@JsonProperty("starttls")
	STARTTLS
}
