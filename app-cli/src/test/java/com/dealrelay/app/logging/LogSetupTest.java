package com.dealrelay.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_fallsBackToInfo() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void setLevel_appliesToRootLogger() {
        Logger root = Logger.getLogger("");
        Level before = root.getLevel();
        try {
            LogSetup.setLevel(Level.FINE);
            assertThat(root.getLevel()).isEqualTo(Level.FINE);
            LogSetup.setLevel(null);
            assertThat(root.getLevel()).isEqualTo(Level.INFO);
        } finally {
            root.setLevel(before);
        }
    }
}
