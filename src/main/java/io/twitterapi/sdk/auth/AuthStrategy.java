package io.twitterapi.sdk.auth;

/**
 * Authentication schemes, in selection priority order.
 */
public enum AuthStrategy {
    BEARER,
    BASIC,
    CLIENT_CREDENTIALS,
    OAUTH1,
    NONE
}
