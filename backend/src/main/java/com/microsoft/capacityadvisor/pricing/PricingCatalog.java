package com.microsoft.capacityadvisor.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.*;

/**
 * Read-only pricing and downgrade tables.
 *
 * DATA SOURCE:
 * A JSON document listing, per tier, the monthly unit cost of each SKU, the
 * SKU used as the tier's default estimate (or an explicit fallback cost for
 * unknown SKUs) and the "one step down" neighbour of each SKU.
 * See {@code pricing/app-service-plan-pricing.json}.
 *
 * MATCHING:
 * Tier names (and their aliases) match case-insensitively, SKU names match
 * case-insensitively. Downgrade targets are returned as written in the
 * document.
 *
 * The lookup maps are built once in the constructor and never modified, so
 * one instance is safely shared across worker threads.
 */
public final class PricingCatalog {

    private final BigDecimal flatEstimate;
    private final Map<String, TierTable> tiersByKey;
    private final Map<String, SkuPrice> pricesBySku;

    public PricingCatalog(CatalogDocument document) {
        Objects.requireNonNull(document, "document");
        this.flatEstimate = document.flatEstimate() != null ? document.flatEstimate() : BigDecimal.valueOf(100);

        Map<String, TierTable> tiers = new HashMap<>();
        Map<String, SkuPrice> bySku = new HashMap<>();

        for (TierDocument tier : Optional.ofNullable(document.tiers()).orElse(List.of())) {
            TierTable table = new TierTable(tier);
            tiers.put(tierKey(tier.name()), table);
            for (String alias : Optional.ofNullable(tier.aliases()).orElse(List.of())) {
                tiers.put(tierKey(alias), table);
            }
            table.unitCosts().forEach((sku, cost) ->
                    bySku.putIfAbsent(sku, new SkuPrice(tier.name(), table.skuNames().get(sku), cost)));
        }

        this.tiersByKey = Map.copyOf(tiers);
        this.pricesBySku = Map.copyOf(bySku);
    }

    public static PricingCatalog fromJson(InputStream json, ObjectMapper objectMapper) throws IOException {
        return new PricingCatalog(objectMapper.readValue(json, CatalogDocument.class));
    }

    public BigDecimal flatEstimate() {
        return flatEstimate;
    }

    /**
     * Unit cost registered for exactly this tier and SKU.
     */
    public Optional<BigDecimal> unitCost(String tier, String skuName) {
        return tier(tier).map(table -> table.unitCosts().get(skuKey(skuName)));
    }

    /**
     * Unit cost of the SKU under whichever tier registers it.
     * Covers source data whose tier label does not match the catalog.
     */
    public Optional<SkuPrice> unitCostAnyTier(String skuName) {
        return Optional.ofNullable(pricesBySku.get(skuKey(skuName)));
    }

    /**
     * Unit cost used when the tier is known but the SKU is not: the tier's
     * explicit fallback cost when it declares one, otherwise its default SKU's cost.
     */
    public Optional<SkuPrice> tierDefault(String tier) {
        return tier(tier).flatMap(table -> {
            String defaultKey = skuKey(table.document().defaultSku());
            BigDecimal cost = table.document().fallbackUnitCost() != null
                    ? table.document().fallbackUnitCost()
                    : table.unitCosts().get(defaultKey);
            return cost == null
                    ? Optional.empty()
                    : Optional.of(new SkuPrice(table.document().name(), table.document().defaultSku(), cost));
        });
    }

    /**
     * The next smaller SKU for this tier and SKU, if one is registered.
     * When the tier label is unknown the SKU is looked up across all tiers.
     */
    public Optional<SkuRef> downgradeOf(String tier, String skuName) {
        String sku = skuKey(skuName);
        Optional<TierTable> exact = tier(tier);
        if (exact.isPresent()) {
            String target = exact.get().downgrades().get(sku);
            return Optional.ofNullable(target).map(t -> new SkuRef(tier, t));
        }
        return tiersByKey.values().stream()
                .filter(table -> table.downgrades().containsKey(sku))
                .findFirst()
                .map(table -> new SkuRef(table.document().name(), table.downgrades().get(sku)));
    }

    public boolean isRegistered(String tier, String skuName) {
        return unitCost(tier, skuName).isPresent();
    }

    private Optional<TierTable> tier(String tier) {
        return tier == null ? Optional.empty() : Optional.ofNullable(tiersByKey.get(tierKey(tier)));
    }

    private static String tierKey(String tier) {
        return tier.trim().toLowerCase(Locale.ROOT);
    }

    static String skuKey(String skuName) {
        return skuName == null ? "" : skuName.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Tier and SKU name pair as written in the catalog.
     */
    public record SkuRef(String tier, String skuName) {}

    /**
     * Unit cost together with where in the catalog it was found.
     */
    public record SkuPrice(String tier, String skuName, BigDecimal unitCost) {}

    /**
     * Indexed form of one tier: SKU keys are normalized, display names kept.
     */
    private record TierTable(
            TierDocument document,
            Map<String, BigDecimal> unitCosts,
            Map<String, String> skuNames,
            Map<String, String> downgrades
    ) {
        TierTable(TierDocument document) {
            this(document, index(document.unitCosts()), names(document.unitCosts()), indexDowngrades(document.downgrades()));
        }

        private static Map<String, BigDecimal> index(Map<String, BigDecimal> costs) {
            Map<String, BigDecimal> indexed = new HashMap<>();
            Optional.ofNullable(costs).orElse(Map.of()).forEach((sku, cost) -> {
                if (cost == null || cost.signum() < 0) {
                    throw new IllegalArgumentException("Unit cost for SKU " + sku + " must be non-negative");
                }
                indexed.put(skuKey(sku), cost);
            });
            return Map.copyOf(indexed);
        }

        private static Map<String, String> names(Map<String, BigDecimal> costs) {
            Map<String, String> names = new HashMap<>();
            Optional.ofNullable(costs).orElse(Map.of()).keySet().forEach(sku -> names.put(skuKey(sku), sku));
            return Map.copyOf(names);
        }

        private static Map<String, String> indexDowngrades(Map<String, String> downgrades) {
            Map<String, String> indexed = new HashMap<>();
            Optional.ofNullable(downgrades).orElse(Map.of()).forEach((from, to) -> indexed.put(skuKey(from), to));
            return Map.copyOf(indexed);
        }
    }

    // JSON document shape

    public record CatalogDocument(
            String currency,
            BigDecimal flatEstimate,
            List<TierDocument> tiers
    ) {}

    public record TierDocument(
            String name,
            List<String> aliases,
            String defaultSku,
            BigDecimal fallbackUnitCost,
            Map<String, BigDecimal> unitCosts,
            Map<String, String> downgrades
    ) {}
}
