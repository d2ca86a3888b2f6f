/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.math.BigInteger;

/**
 * Library constants.
 */
public class EscrowConstants {

  // no-one calls
  private EscrowConstants() {  }
  
  
  /**
   * Bit width of an escrowed amount. Face values must fit in this
   * many bits.
   */
  public final static int AMOUNT_BITS = 192;
  
  /**
   * Largest representable escrow face value ({@code 2^192 - 1}).
   */
  public final static BigInteger MAX_FACE_VALUE =
      BigInteger.ONE.shiftLeft(AMOUNT_BITS).subtract(BigInteger.ONE);
  
  /** Number of decimal places in one whole unit of the escrowed asset. */
  public final static int DECIMALS = 18;
  
  /** One whole unit of the escrowed asset ({@code 10^18}). */
  public final static BigInteger UNIT = BigInteger.TEN.pow(DECIMALS);
  
  /** Seconds in a day index. */
  public final static long SECONDS_PER_DAY = 24 * 60 * 60;
  

  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public final static String LOGGER_NAME = "escrow";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }
  
  
  public static void logWarning(String message) {
    getLogger().log(Level.WARNING, message);
  }
  
  
  public static void logDebug(String message) {
    var log = getLogger();
    if (log.isLoggable(Level.DEBUG))
      log.log(Level.DEBUG, message);
  }

}
