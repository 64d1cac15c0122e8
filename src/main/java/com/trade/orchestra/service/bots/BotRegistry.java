package com.trade.orchestra.service.bots;

import com.trade.orchestra.enums.BotCategory;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.model.BotMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalogue of the bots known to the platform.
 */
@Component
@Slf4j
public class BotRegistry {

    private static final String VERSION = "2.0.0";

    private final Map<BotCode, BotMetadata> bots = Collections.synchronizedMap(new EnumMap<>(BotCode.class));

    public BotRegistry() {
        // operational
        add(BotCode.GRD, "MESH", BotCategory.OPERATIONAL, "Grid trading inside a price channel");
        add(BotCode.DCA, "SCALE", BotCategory.OPERATIONAL, "Dollar cost averaging into a position");
        add(BotCode.BBB, "BAND", BotCategory.OPERATIONAL, "Bollinger band trading");
        add(BotCode.RNG, "EDGE", BotCategory.OPERATIONAL, "Range trading in sideways markets");
        add(BotCode.PND, "Argus", BotCategory.OPERATIONAL, "Pump and dump detection");
        add(BotCode.FCS, "Vision", BotCategory.OPERATIONAL, "Price forecasting");
        // institutional
        add(BotCode.ARB, "Orion", BotCategory.INSTITUTIONAL, "Cross-exchange arbitrage");
        add(BotCode.PAR, "Spectrum", BotCategory.INSTITUTIONAL, "Pairs trading");
        add(BotCode.STA, "Reed", BotCategory.INSTITUTIONAL, "Statistical trading strategies");
        add(BotCode.MMK, "Architect", BotCategory.INSTITUTIONAL, "Market making");
        add(BotCode.MRB, "Equilibrist", BotCategory.INSTITUTIONAL, "Mean reversion basket");
        add(BotCode.TRF, "Kron", BotCategory.INSTITUTIONAL, "Transfers and rebalancing");
        // frequency
        add(BotCode.HFT, "Helios", BotCategory.FREQUENCY, "High frequency trading");
        add(BotCode.MFT, "Selene", BotCategory.FREQUENCY, "Medium frequency trading");
        add(BotCode.LFT, "Atlas", BotCategory.FREQUENCY, "Low frequency trading");
        // integration
        add(BotCode.ORA, "Oracle", BotCategory.INTEGRATION, "Chat assistant");
        add(BotCode.LUM, "Lumi", BotCategory.INTEGRATION, "Data integration");
        add(BotCode.WLF, "Wolf", BotCategory.INTEGRATION, "Alert system");
        // analytics
        add(BotCode.LOG, "LOGOS", BotCategory.ANALYTICS, "Meta analyst and autonomous trader");
    }

    private void add(BotCode code, String name, BotCategory category, String description) {
        bots.put(code, new BotMetadata(code, name, category, description, VERSION, true));
    }

    public Optional<BotMetadata> getBot(BotCode code) {
        return Optional.ofNullable(bots.get(code));
    }

    /**
     * Display name, or the code itself for an unknown bot.
     */
    public String getBotName(BotCode code) {
        BotMetadata m = bots.get(code);
        return m == null ? String.valueOf(code) : m.name();
    }

    public List<BotMetadata> getAll() {
        synchronized (bots) {
            return new ArrayList<>(bots.values());
        }
    }

    public List<BotCode> getAllCodes() {
        synchronized (bots) {
            return new ArrayList<>(bots.keySet());
        }
    }

    public List<BotMetadata> getByCategory(BotCategory category) {
        List<BotMetadata> out = new ArrayList<>();
        for (BotMetadata m : getAll()) {
            if (m.category() == category) out.add(m);
        }
        return out;
    }

    public List<BotCode> getCodesByCategory(BotCategory category) {
        List<BotCode> out = new ArrayList<>();
        for (BotMetadata m : getByCategory(category)) out.add(m.code());
        return out;
    }

    public List<BotMetadata> getEnabled() {
        List<BotMetadata> out = new ArrayList<>();
        for (BotMetadata m : getAll()) {
            if (m.enabled()) out.add(m);
        }
        return out;
    }

    public boolean setEnabled(BotCode code, boolean enabled) {
        BotMetadata m = bots.computeIfPresent(code, (k, v) -> v.withEnabled(enabled));
        if (m == null) return false;
        log.info("Bot {} ({}) {}", code, m.name(), enabled ? "enabled" : "disabled");
        return true;
    }
}
