package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IrDocumentDTO
{
	public String source;
	public boolean complete;
	public List<OperationDTO> operations = new ArrayList<>();
	public List<TypeDTO> types = new ArrayList<>();
	public int frameSize;
	public int staticSize;
	public String entry;
	public List<BlockDTO> blocks = new ArrayList<>();
	public Map<String, String> immediateDominators = new LinkedHashMap<>();
	public List<LoopDTO> loops = new ArrayList<>();
	public List<OpportunityDTO> optimizationOpportunities = new ArrayList<>();
	public DiagnosticsDTO diagnostics = new DiagnosticsDTO();
}
