package com.codeheadsystems.keychain.model;

/**
 * Result of a system-identity lookup.
 *
 * @param identity     the identity found
 * @param actualDomain the domain tag whose entry was used; differs from the requested tag when
 *                     the lookup fell back to the system default entry
 */
public record SystemIdentity(Identity identity, String actualDomain) {
}
