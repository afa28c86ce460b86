package com.example.portalsync.adapter.portal;

/**
 * Maps a username and password to the opaque credential token the upstream login form expects.
 * Replace the default bean to plug in a different algorithm.
 */
@FunctionalInterface
public interface CredentialEncoder {

  String encode(String username, String password);
}
