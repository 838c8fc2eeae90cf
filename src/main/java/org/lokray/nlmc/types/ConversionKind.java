package org.lokray.nlmc.types;

public enum ConversionKind
{
	IMPLICIT, EXPLICIT, COERCION, CAST, CONSTRUCTOR
}
