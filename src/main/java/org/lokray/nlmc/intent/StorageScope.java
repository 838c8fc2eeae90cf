package org.lokray.nlmc.intent;

import java.util.Locale;
import java.util.Objects;

/**
 * Where a data structure lives: global storage, a named function, or a block.
 */
public class StorageScope
{
	public enum Kind
	{
		GLOBAL, FUNCTION, BLOCK
	}

	public static final StorageScope GLOBAL = new StorageScope(Kind.GLOBAL, null);

	private final Kind kind;
	private final String name;

	private StorageScope(Kind kind, String name)
	{
		this.kind = kind;
		this.name = name;
	}

	public static StorageScope function(String name)
	{
		return new StorageScope(Kind.FUNCTION, Objects.requireNonNull(name));
	}

	public static StorageScope block(String id)
	{
		return new StorageScope(Kind.BLOCK, Objects.requireNonNull(id));
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * Function name or block id; null for the global scope.
	 */
	public String getName()
	{
		return name;
	}

	public boolean isLocal()
	{
		return kind != Kind.GLOBAL;
	}

	@Override
	public String toString()
	{
		return kind == Kind.GLOBAL ? "global" : kind.name().toLowerCase(Locale.ROOT) + ":" + name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		StorageScope that = (StorageScope) o;
		return kind == that.kind && Objects.equals(name, that.name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, name);
	}
}
