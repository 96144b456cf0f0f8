package com.solfmt.plugins.solidity.format;

import java.util.Optional;

/**
 * Rewrites a version-range literal, such as the value of {@code pragma solidity}, into canonical
 * form.
 */
@FunctionalInterface
public interface VersionNormalizer {

    /**
     * @return the canonical rendering, or empty if the literal is not a range this normalizer
     *     understands
     */
    Optional<String> normalize(String literal);
}
