package ch.ethz.systems.wimaxbench.xpt.wimax.phy;

/**
 * Physical layer as seen by the MAC: conversion between OFDM symbols and
 * bytes for a modulation, and the duration of a MAC frame.
 *
 * Implementations must keep the two conversions consistent:
 * <code>getNrSymbols(getNrBytes(s, m), m) &lt;= s</code> for all symbol counts <code>s</code>.
 */
public interface IWimaxPhy {

    /**
     * Number of bytes which can be carried in the given number of symbols.
     *
     * @param symbols           Number of OFDM symbols
     * @param modulationType    Modulation and coding scheme
     *
     * @return  Byte capacity
     */
    int getNrBytes(int symbols, ModulationType modulationType);

    /**
     * Number of symbols required to carry the given number of bytes.
     *
     * @param bytes             Number of bytes
     * @param modulationType    Modulation and coding scheme
     *
     * @return  Symbols required
     */
    int getNrSymbols(int bytes, ModulationType modulationType);

    /**
     * Duration of one MAC frame.
     *
     * @return  Frame duration in nanoseconds
     */
    long getFrameDurationNs();

}
