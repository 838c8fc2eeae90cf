package org.lokray.nlmc.types;

/**
 * Ordered from cheapest to impossible.
 */
public enum ConversionCost
{
	FREE, CHEAP, MODERATE, EXPENSIVE, PROHIBITED
}
