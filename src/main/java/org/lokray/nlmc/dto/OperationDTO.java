package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class OperationDTO
{
	public String id;
	public String kind;
	public String type;
	public List<String> inputs = new ArrayList<>();
	public List<String> outputs = new ArrayList<>();
	public String description;
	public double confidence;
}
