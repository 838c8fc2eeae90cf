package org.lokray.nlmc.dto;

public class TypeDTO
{
	public String entity;
	public String name;
	public String baseType;
	public int size;
	public int alignment;
	public String lifetime;
	public String mutability;
	public String ownership;
	public boolean nullable;
	// "stack", "static" or null when the entity has no fixed slot
	public String segment;
	public Integer offset;
}
