package org.vaultprep.engine.compiler;

import java.util.Map;
import java.util.Objects;

/**
 * Policy switches for the compilers.
 *
 * Environment variables:
 * - VAULTPREP_LINK_POLICY: "placeholder" (default) or "skip"
 * - VAULTPREP_IMPLICIT_SATELLITE: "true" to synthesize one satellite per table
 *   without hashdiff groups (default "false")
 *
 * @param linkReferencePolicy What to emit for unresolvable link references
 * @param implicitSatellite   Whether tables without hashdiff groups get an implicit satellite
 */
public record CompilerOptions(
        LinkReferencePolicy linkReferencePolicy,
        boolean implicitSatellite) {

    public static final String LINK_POLICY_ENV = "VAULTPREP_LINK_POLICY";
    public static final String IMPLICIT_SATELLITE_ENV = "VAULTPREP_IMPLICIT_SATELLITE";

    public CompilerOptions {
        Objects.requireNonNull(linkReferencePolicy, "linkReferencePolicy");
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(LinkReferencePolicy.PLACEHOLDER, false);
    }

    /**
     * Reads the options from the process environment, falling back to defaults.
     */
    public static CompilerOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static CompilerOptions fromEnvironment(Map<String, String> env) {
        CompilerOptions options = defaults();
        String policy = env.get(LINK_POLICY_ENV);
        if (policy != null && !policy.isBlank()) {
            options = options.withLinkReferencePolicy(LinkReferencePolicy.fromString(policy));
        }
        String implicit = env.get(IMPLICIT_SATELLITE_ENV);
        if (implicit != null && !implicit.isBlank()) {
            options = options.withImplicitSatellite(Boolean.parseBoolean(implicit.trim()));
        }
        return options;
    }

    public CompilerOptions withLinkReferencePolicy(LinkReferencePolicy policy) {
        return new CompilerOptions(policy, implicitSatellite);
    }

    public CompilerOptions withImplicitSatellite(boolean enabled) {
        return new CompilerOptions(linkReferencePolicy, enabled);
    }
}
