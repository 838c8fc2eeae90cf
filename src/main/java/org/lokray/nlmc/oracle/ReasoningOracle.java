package org.lokray.nlmc.oracle;

/**
 * Text-in/text-out access to the external reasoning service.
 * <p>
 * Every analysis stage receives the same instance. Callers must treat a thrown
 * {@link OracleException} or an unparsable answer as "no information".
 */
public interface ReasoningOracle
{
	String query(String prompt) throws OracleException;
}
