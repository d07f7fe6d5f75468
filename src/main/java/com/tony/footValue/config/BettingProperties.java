package com.tony.footValue.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "betting")
@Data
public class BettingProperties {

    // --- Kelly ---
    private double maxKellyFraction = 0.25; // Kelly fractionnaire : marge contre la sur-confiance du modèle
    private double minKellyFraction = 0.03; // En dessous : micro-mise sans intérêt

    // --- Seuils de value (EV = proba x cote) ---
    private double highValueEv = 1.15;
    private double mediumValueEv = 1.05;

    // Marge bookmaker supposée quand aucune cote n'est fournie
    private double bookmakerMargin = 0.10;

    // Combinés analysés seulement au-dessus de cette probabilité
    private double comboMinProbability = 0.10;

    // --- Bankroll ---
    private double initialBankroll = 1000.0;
}
