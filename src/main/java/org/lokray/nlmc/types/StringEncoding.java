package org.lokray.nlmc.types;

public enum StringEncoding
{
	UTF8, UTF16, UTF32, ASCII
}
