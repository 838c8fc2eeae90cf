package org.lokray.nlmc.types;

import org.lokray.nlmc.intent.StorageScope;

/**
 * How long a value lives, from shortest to longest.
 */
public enum Lifetime
{
	UNKNOWN, BLOCK, PARAMETER, FUNCTION, HEAP, STATIC;

	public static Lifetime of(StorageScope scope)
	{
		switch (scope.getKind())
		{
			case FUNCTION:
				return FUNCTION;
			case BLOCK:
				return BLOCK;
			default:
				return STATIC;
		}
	}

	public boolean isStackAllocated()
	{
		return this == FUNCTION || this == BLOCK;
	}
}
