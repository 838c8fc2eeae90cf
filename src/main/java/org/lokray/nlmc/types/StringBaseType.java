package org.lokray.nlmc.types;

import java.util.Locale;
import java.util.Objects;

/**
 * An owned string: pointer, length and capacity.
 */
public class StringBaseType extends BaseType
{
	private final StringEncoding encoding;

	public StringBaseType(StringEncoding encoding)
	{
		this.encoding = Objects.requireNonNull(encoding);
	}

	public StringEncoding getEncoding()
	{
		return encoding;
	}

	@Override
	public String getName()
	{
		return encoding == StringEncoding.UTF8 ? "string" : "string<" + encoding.name().toLowerCase(Locale.ROOT) + ">";
	}

	@Override
	public int sizeBytes()
	{
		return 24;
	}

	@Override
	public int alignment()
	{
		return 8;
	}
}
