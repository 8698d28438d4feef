package com.entityradar.labels;

import com.entityradar.config.KnownAddressProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Set-based registry built once from {@link KnownAddressProperties}. Immutable after construction, so tests can
 * build a synthetic address universe by passing their own properties.
 */
@Component
public class DefaultKnownAddressRegistry implements KnownAddressRegistry {

    private final Set<String> cex;
    private final Set<String> bridges;
    private final Set<String> dexRouters;
    private final String weth;
    private final String usdt;

    public DefaultKnownAddressRegistry(KnownAddressProperties properties) {
        this.cex = normalize(properties.getCex());
        this.bridges = normalize(properties.getBridges());
        this.dexRouters = normalize(properties.getDexRouters());
        this.weth = key(properties.getWeth());
        this.usdt = key(properties.getUsdt());
    }

    @Override
    public boolean isCex(String address) {
        String key = key(address);
        return !key.isEmpty() && cex.contains(key);
    }

    @Override
    public boolean isBridge(String address) {
        String key = key(address);
        return !key.isEmpty() && bridges.contains(key);
    }

    @Override
    public boolean isDexRouter(String address) {
        String key = key(address);
        return !key.isEmpty() && dexRouters.contains(key);
    }

    @Override
    public boolean isWeth(String address) {
        String key = key(address);
        return !key.isEmpty() && key.equals(weth);
    }

    @Override
    public boolean isUsdt(String address) {
        String key = key(address);
        return !key.isEmpty() && key.equals(usdt);
    }

    private static Set<String> normalize(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return Set.of();
        }
        return addresses.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.strip().toLowerCase())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String key(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        return address.strip().toLowerCase();
    }
}
