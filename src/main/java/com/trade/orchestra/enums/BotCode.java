package com.trade.orchestra.enums;

/**
 * Three-letter identity of every strategy executor and service that talks on the bus.
 */
public enum BotCode {
    // operational
    GRD, DCA, BBB, RNG, PND, FCS,
    // institutional
    ARB, PAR, STA, MMK, MRB, TRF,
    // frequency
    HFT, MFT, LFT,
    // integration & analytics
    ORA, LUM, WLF, LOG
}
