package com.tony.footValue.model;

/**
 * Cycle de vie d'un match, codes du fournisseur de données.
 */
public enum MatchStatus {
    TBD, NS, LIVE, HT, FT, AET, PEN, PST, CANC, ABD, SUSP, AWD, WO;

    /** Seul FT alimente les modèles et déclenche le règlement des paris. */
    public boolean isFinished() {
        return this == FT;
    }

    /** Statut final : plus aucun pari ne peut être placé. */
    public boolean isTerminal() {
        return switch (this) {
            case FT, AET, PEN, CANC, ABD, AWD, WO -> true;
            default -> false;
        };
    }

    public boolean isScheduled() {
        return this == NS || this == TBD;
    }
}
