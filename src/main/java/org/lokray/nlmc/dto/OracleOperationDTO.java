package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class OracleOperationDTO
{
	public String id;
	public String operationType;
	public String target;
	public String name;
	public String condition;
	public List<String> inputs = new ArrayList<>();
	public List<String> outputs = new ArrayList<>();
	public String description;
	public Double confidence;
}
