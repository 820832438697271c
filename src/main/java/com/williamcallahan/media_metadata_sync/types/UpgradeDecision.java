/**
 * Result of comparing a candidate image against the persisted asset
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param upgrade whether the rules call for replacing the persisted asset
 * @param status  rule that decided the outcome
 * @param context values that drove the decision, for logging
 * @param dryRun  when true, callers must report the decision without writing
 */
public record UpgradeDecision(boolean upgrade, UpgradeStatus status, Map<String, Object> context, boolean dryRun) {

    public UpgradeDecision {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static UpgradeDecision of(UpgradeStatus status, Map<String, Object> context, boolean dryRun) {
        return new UpgradeDecision(status.isUpgrade(), status, context, dryRun);
    }

    /**
     * True only when an upgrade is called for and the run is allowed to write
     */
    public boolean shouldWrite() {
        return upgrade && !dryRun;
    }
}
