/*******************************************************************************
 * BGCNet - Biosynthetic Gene Cluster Networks
 * Copyright 2024 BGCNet developers
 *
 * This file is part of BGCNet.
 *
 *     BGCNet is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BGCNet is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BGCNet.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bgcnet.main;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of a program that can be called from the command line
 * @author BGCNet developers
 *
 */
public class Command {
	private String id;
	private Class<?> program;
	private String title;
	private String description;

	private Map<String,Boolean> arguments = new LinkedHashMap<String,Boolean>();
	private Map<String, CommandOption> options = new LinkedHashMap<String,CommandOption>();

	public Command(String id, Class<?> program) {
		this.id = id;
		this.program = program;
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getTitle() {
		return title;
	}
	public void setTitle(String title) {
		this.title = title;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public List<String> getArguments() {
		return new ArrayList<String>(arguments.keySet());
	}
	public boolean isMultiple(String argument) {
		Boolean mult = arguments.get(argument);
		return mult!=null && mult.booleanValue();
	}
	public void addArgument(String argument, boolean isMultiple) {
		arguments.put(argument,isMultiple);
	}
	public List<CommandOption> getOptionsList() {
		return new ArrayList<CommandOption>(options.values());
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new IllegalArgumentException("Duplicated option id: "+option.getId());
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
}
