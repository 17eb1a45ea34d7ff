package com.relationsim.common.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModifierPresetTableTest {

    @Test
    @DisplayName("every trust × resentment combination has a preset")
    void completeTable() {
        for (TrustBand trust : TrustBand.values()) {
            for (ResentmentBand resentment : ResentmentBand.values()) {
                assertNotNull(ModifierPresetTable.lookup(new RelationshipTone(trust, resentment)),
                    trust + "/" + resentment);
            }
        }
    }

    @Test
    @DisplayName("high trust, low resentment → OPEN with full cooperation and vulnerability")
    void open() {
        ModifierPreset preset = ModifierPresetTable.lookup(80.0, 10.0);
        assertEquals(ToneStrategy.OPEN, preset.strategy());
        assertEquals(1.0, preset.cooperationBase());
        assertEquals(1.0, preset.vulnerabilityCap());
    }

    @Test
    @DisplayName("high trust, simmering resentment → RECEPTIVE")
    void receptive() {
        ModifierPreset preset = ModifierPresetTable.lookup(80.0, 40.0);
        assertEquals(ToneStrategy.RECEPTIVE, preset.strategy());
        assertEquals(0.7, preset.cooperationBase());
        assertEquals(0.9, preset.vulnerabilityCap());
    }

    @Test
    @DisplayName("steady trust, bitter resentment → DEFENSIVE")
    void defensive() {
        ModifierPreset preset = ModifierPresetTable.lookup(60.0, 60.0);
        assertEquals(ToneStrategy.DEFENSIVE, preset.strategy());
        assertEquals(0.4, preset.cooperationBase());
        assertEquals(0.56, preset.vulnerabilityCap());
    }

    @Test
    @DisplayName("low trust dominates resentment → WITHDRAWN")
    void withdrawn() {
        ModifierPreset preset = ModifierPresetTable.lookup(30.0, 80.0);
        assertEquals(ToneStrategy.WITHDRAWN, preset.strategy());
        assertEquals(0.2, preset.cooperationBase());
        assertEquals(0.15, preset.vulnerabilityCap());
        assertEquals(ToneStrategy.GUARDED, ModifierPresetTable.lookup(45.0, 10.0).strategy());
        assertEquals(ToneStrategy.CAUTIOUS, ModifierPresetTable.lookup(60.0, 10.0).strategy());
    }

    @Test
    @DisplayName("band boundaries")
    void boundaries() {
        assertEquals(TrustBand.HIGH,    TrustBand.of(70.01));
        assertEquals(TrustBand.STEADY,  TrustBand.of(70.0));
        assertEquals(TrustBand.STEADY,  TrustBand.of(50.0));
        assertEquals(TrustBand.GUARDED, TrustBand.of(49.99));
        assertEquals(TrustBand.GUARDED, TrustBand.of(40.0));
        assertEquals(TrustBand.LOW,     TrustBand.of(39.99));

        assertEquals(ResentmentBand.LOW,       ResentmentBand.of(29.99));
        assertEquals(ResentmentBand.SIMMERING, ResentmentBand.of(30.0));
        assertEquals(ResentmentBand.BITTER,    ResentmentBand.of(50.0));
        assertEquals(ResentmentBand.HOSTILE,   ResentmentBand.of(70.0));
    }
}
