package com.microsoft.capacityadvisor.pricing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prices a (tier, SKU, capacity) configuration from the pricing catalog.
 *
 * monthlyCost = unitCost * capacity. The lookup never fails:
 * 1. exact tier + SKU match
 * 2. the SKU registered under another tier (tier label mismatch)
 * 3. the tier's default SKU (flagged as estimated)
 * 4. the catalog's flat per-instance estimate (flagged as estimated)
 *
 * Flagged lookups are logged once per tier/SKU pair as data-quality notes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CostModel {

    private final PricingCatalog catalog;

    private final Set<String> reportedFallbacks = ConcurrentHashMap.newKeySet();

    public CostEstimate cost(String tier, String skuName, int capacity) {
        BigDecimal instances = BigDecimal.valueOf(Math.max(0, capacity));

        Optional<BigDecimal> exact = catalog.unitCost(tier, skuName);
        if (exact.isPresent()) {
            return CostEstimate.exact(exact.get().multiply(instances));
        }

        var byName = catalog.unitCostAnyTier(skuName);
        if (byName.isPresent()) {
            log.debug("SKU {} not registered under tier {}, priced as {} {}",
                    skuName, tier, byName.get().tier(), byName.get().skuName());
            return CostEstimate.exact(byName.get().unitCost().multiply(instances));
        }

        var tierDefault = catalog.tierDefault(tier);
        if (tierDefault.isPresent()) {
            noteFallback(tier, skuName, "priced as tier default " + tierDefault.get().skuName());
            return CostEstimate.estimate(tierDefault.get().unitCost().multiply(instances));
        }

        noteFallback(tier, skuName, "using flat estimate of " + catalog.flatEstimate() + " per instance");
        return CostEstimate.estimate(catalog.flatEstimate().multiply(instances));
    }

    private void noteFallback(String tier, String skuName, String detail) {
        if (reportedFallbacks.add(tier + "/" + skuName)) {
            log.warn("Unknown SKU '{}/{}' - {}; cost totals are best-effort", tier, skuName, detail);
        }
    }
}
