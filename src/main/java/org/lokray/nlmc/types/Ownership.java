package org.lokray.nlmc.types;

public enum Ownership
{
	OWNED, BORROWED, SHARED, WEAK
}
