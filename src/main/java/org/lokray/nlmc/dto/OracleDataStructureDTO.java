package org.lokray.nlmc.dto;

public class OracleDataStructureDTO
{
	public String name;
	public String dataType;
	public String scope;
	public Integer size;
	public String initialValue;
}
