package org.lokray.nlmc.intent.operation;

/**
 * What an extracted operation does. The set of variants is closed: consumers go through
 * {@link OperationTypeVisitor}, so adding a variant breaks every consumer that does not handle it.
 */
public abstract class OperationType
{
	// Only the variants in this package may extend it
	OperationType()
	{
	}

	public abstract <R> R accept(OperationTypeVisitor<R> visitor);

	/**
	 * Short lower-case name, e.g. "arithmetic" or "function_call".
	 */
	public abstract String getKindName();

	@Override
	public String toString()
	{
		return getKindName();
	}
}
