package com.trade.orchestra.test.service;

import com.trade.orchestra.enums.BotCategory;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.model.BotMetadata;
import com.trade.orchestra.service.bots.BotRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BotRegistryTest {

    private final BotRegistry registry = new BotRegistry();

    @Test
    void everyCodeIsRegistered() {
        assertThat(registry.getAllCodes()).containsExactlyInAnyOrder(BotCode.values());
        assertThat(registry.getAll()).allMatch(BotMetadata::enabled);
        assertThat(registry.getBotName(BotCode.WLF)).isEqualTo("Wolf");
    }

    @Test
    void categoriesPartitionTheCatalogue() {
        assertThat(registry.getCodesByCategory(BotCategory.FREQUENCY))
                .containsExactly(BotCode.HFT, BotCode.MFT, BotCode.LFT);
        assertThat(registry.getCodesByCategory(BotCategory.INTEGRATION))
                .containsExactly(BotCode.ORA, BotCode.LUM, BotCode.WLF);
        assertThat(registry.getCodesByCategory(BotCategory.ANALYTICS)).containsExactly(BotCode.LOG);

        int total = 0;
        for (BotCategory c : BotCategory.values()) total += registry.getByCategory(c).size();
        assertThat(total).isEqualTo(BotCode.values().length);
    }

    @Test
    void disabledBotsDropOutOfEnabledList() {
        assertThat(registry.setEnabled(BotCode.HFT, false)).isTrue();

        assertThat(registry.getEnabled()).extracting(BotMetadata::code).doesNotContain(BotCode.HFT);
        assertThat(registry.getBot(BotCode.HFT)).hasValueSatisfying(m -> assertThat(m.enabled()).isFalse());
        assertThat(registry.getEnabled()).hasSize(BotCode.values().length - 1);
    }
}
