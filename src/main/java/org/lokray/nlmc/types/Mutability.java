package org.lokray.nlmc.types;

public enum Mutability
{
	MUTABLE, IMMUTABLE, CONST
}
