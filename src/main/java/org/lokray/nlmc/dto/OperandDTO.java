package org.lokray.nlmc.dto;

public class OperandDTO
{
	public String kind;
	public String value;
	public String dataType;
}
