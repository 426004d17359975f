package com.timemarket.core.fhe;

/**
 * Permission for {@code subject} to request plaintext of {@code handle}.
 */
public record AclGrant(String subject, EncryptedHandle handle) {}
