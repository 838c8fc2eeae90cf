package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class OpportunityDTO
{
	public String kind;
	public String description;
	public String benefit;
	public List<String> affectedBlocks = new ArrayList<>();
	public List<String> prerequisites = new ArrayList<>();
}
