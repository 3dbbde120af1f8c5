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

import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

/**
 * Describes the commands available in BGCNet. Commands and their options are loaded
 * from an XML resource, and options given in the command line are set on program instances
 * through the setters of the attributes associated to each option
 * @author BGCNet developers
 *
 */
public class CommandsDescriptor {
	public static final String ATTRIBUTE_VERSION="version";
	public static final String ATTRIBUTE_ID="id";
	public static final String ATTRIBUTE_CLASSNAME="class";
	public static final String ATTRIBUTE_TYPE="type";
	public static final String ATTRIBUTE_DEFAULT_CONSTANT="defaultConstant";
	public static final String ATTRIBUTE_ATTRIBUTE="attribute";
	public static final String ATTRIBUTE_MULTIPLE="multiple";
	public static final String ELEMENT_COMMAND="command";
	public static final String ELEMENT_TITLE="title";
	public static final String ELEMENT_DESCRIPTION="description";
	public static final String ELEMENT_ARGUMENT="argument";
	public static final String ELEMENT_OPTION="option";

	private static final String RESOURCE = "/bgcnet/main/CommandsDescriptor.xml";

	private String swVersion;
	private Map<String,Command> commandsByClass = new HashMap<String,Command>();
	private Map<String,Command> commandsById = new LinkedHashMap<String,Command>();
	private static CommandsDescriptor instance = new CommandsDescriptor();

	private CommandsDescriptor () {
		load();
	}
	public static CommandsDescriptor getInstance() {
		return instance;
	}

	private void load() {
		Document doc;
		try (InputStream is = this.getClass().getResourceAsStream(RESOURCE)) {
			if(is==null) throw new RuntimeException("Commands descriptor resource not found: "+RESOURCE);
			DocumentBuilder documentBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
			doc = documentBuilder.parse(new InputSource(is));
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new RuntimeException("Can not load commands descriptor "+RESOURCE,e);
		}
		Element rootElement = doc.getDocumentElement();
		swVersion = rootElement.getAttribute(ATTRIBUTE_VERSION);
		NodeList offspring = rootElement.getChildNodes();
		for(int i=0;i<offspring.getLength();i++){
			Node node = offspring.item(i);
			if (node instanceof Element && ELEMENT_COMMAND.equals(node.getNodeName())) {
				Element elem = (Element)node;
				Command c;
				try {
					c = loadCommand(elem);
				} catch (RuntimeException e) {
					throw new RuntimeException("Can not load command with id "+elem.getAttribute(ATTRIBUTE_ID),e);
				}
				if(commandsById.containsKey(c.getId())) throw new RuntimeException("Duplicated command id: "+c.getId());
				commandsById.put(c.getId(),c);
				commandsByClass.put(c.getProgram().getName(), c);
			}
		}
	}

	private Command loadCommand(Element cmdElem) {
		String id = cmdElem.getAttribute(ATTRIBUTE_ID);
		if(id.length()==0) throw new RuntimeException("Every command must have an id");
		String className = cmdElem.getAttribute(ATTRIBUTE_CLASSNAME);
		Class<?> program;
		try {
			program = Class.forName(className);
			program.getDeclaredMethod("main",String[].class);
		} catch (ClassNotFoundException e) {
			throw new RuntimeException("Can not load class for command: "+id,e);
		} catch (NoSuchMethodException e) {
			throw new RuntimeException("Class "+className+" for command: "+id+" does not have a main method",e);
		}
		Command cmd = new Command(id,program);
		NodeList offspring = cmdElem.getChildNodes();
		for(int i=0;i<offspring.getLength();i++){
			Node node = offspring.item(i);
			if (!(node instanceof Element)) continue;
			Element elem = (Element)node;
			if(ELEMENT_TITLE.equals(elem.getNodeName())) {
				cmd.setTitle(loadText(elem));
			} else if(ELEMENT_DESCRIPTION.equals(elem.getNodeName())) {
				cmd.setDescription(loadText(elem));
			} else if(ELEMENT_ARGUMENT.equals(elem.getNodeName())) {
				cmd.addArgument(loadText(elem),"true".equals(elem.getAttribute(ATTRIBUTE_MULTIPLE).trim().toLowerCase()));
			} else if(ELEMENT_OPTION.equals(elem.getNodeName())) {
				cmd.addOption(loadOption(program, elem));
			}
		}
		return cmd;
	}

	private CommandOption loadOption(Class<?> program, Element elem) {
		String optId = elem.getAttribute(ATTRIBUTE_ID);
		if(optId.length()==0) throw new RuntimeException("Every option must have an id");
		CommandOption opt = new CommandOption(optId);
		String optType = elem.getAttribute(ATTRIBUTE_TYPE);
		if(optType.length()>0) opt.setType(optType);
		String optDefaultConstant = elem.getAttribute(ATTRIBUTE_DEFAULT_CONSTANT);
		if(optDefaultConstant.trim().length()>0) opt.setDefaultValue(loadValue(program,optDefaultConstant.trim()));
		String optAttribute = elem.getAttribute(ATTRIBUTE_ATTRIBUTE);
		if(optAttribute.trim().length()>0) opt.setAttribute(optAttribute.trim());
		String description = loadText(elem);
		if(description==null || description.length()==0) throw new RuntimeException("Option "+optId+" does not have a description");
		opt.setDescription(description);
		return opt;
	}

	private String loadValue(Class<?> program, String constantName) {
		try {
			return ""+program.getDeclaredField(constantName).get(null);
		} catch (IllegalArgumentException | IllegalAccessException | NoSuchFieldException | SecurityException e) {
			throw new RuntimeException("Can not load value of constant "+constantName+" in class "+program.getName(),e);
		}
	}

	private String loadText(Element elem) {
		NodeList offspring = elem.getChildNodes();
		for (int i=0; i < offspring.getLength(); i++) {
			Node subnode = offspring.item(i);
			if (subnode.getNodeType() == Node.TEXT_NODE) {
				String desc = subnode.getNodeValue();
				if(desc!=null) return desc.trim().replaceAll("\\s+", " ");
			}
		}
		return null;
	}

	public String getSwVersion() {
		return swVersion;
	}
	public Command getCommand(String id) {
		return commandsById.get(id);
	}
	public Command getCommandByClass(String classname) {
		return commandsByClass.get(classname);
	}

	/**
	 * Prints the help of the command implemented by the given program
	 * @param program Class implementing the command
	 * @param out Stream to print the help
	 */
	public void printHelp(Class<?> program, PrintStream out) {
		Command c = commandsByClass.get(program.getName());
		if(c==null) throw new IllegalArgumentException("No command registered for class: "+program.getName());
		out.println(c.getTitle());
		out.println();
		out.println(c.getDescription());
		out.println();
		out.print("USAGE: java -jar BGCNetcore_"+swVersion+".jar "+ c.getId()+" <OPTIONS>");
		for(String arg:c.getArguments()) {
			out.print(" <"+arg+">");
			if(c.isMultiple(arg)) out.print("*");
		}
		out.println();
		out.println();
		out.println("OPTIONS:");
		out.println();
		for(CommandOption option:c.getOptionsList()) {
			out.print("        -"+option.getId());
			if(!option.isBoolean()) out.print(" "+option.getType());
			String desc = option.getDescription();
			if(option.getDefaultValue()!=null) desc+=" Default: "+option.getDefaultValue();
			out.println("\t: "+desc);
		}
		out.println();
	}

	/**
	 * Loads the options given in the command line into a program instance
	 * @param programInstance Object of a program implementing one command
	 * @param args Arguments sent by the user
	 * @return int Index of the first argument that is not an option
	 * @throws IllegalArgumentException If an option is not recognized or its value can not be decoded
	 */
	public int loadOptions(Object programInstance, String [] args ) {
		if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")){
			printHelp(programInstance.getClass(), System.err);
			System.exit(1);
		}
		Command c = commandsByClass.get(programInstance.getClass().getName());
		if(c==null) throw new IllegalArgumentException("No command registered for class: "+programInstance.getClass().getName());
		int i = 0;
		while(i<args.length && args[i].length()>1 && args[i].charAt(0)=='-') {
			CommandOption o = c.getOption(args[i].substring(1));
			if (o==null) {
				printHelp(programInstance.getClass(), System.err);
				throw new IllegalArgumentException("Unrecognized option "+args[i]);
			}
			Method setter = o.findSetMethod(programInstance);
			Object value;
			if(o.isBoolean()) {
				value = setter.getParameterTypes()[0].equals(String.class)?"true":Boolean.TRUE;
			} else {
				i++;
				if(i==args.length) throw new IllegalArgumentException("Missing value for option -"+o.getId());
				if(setter.getParameterTypes()[0].equals(String.class)) {
					value = args[i];
				} else {
					try {
						value = o.decodeValue(args[i]);
					} catch (NumberFormatException e) {
						throw new IllegalArgumentException("Error loading value \""+args[i]+"\" for option \""+o.getId()+"\" of type "+o.getType(),e);
					}
				}
			}
			try {
				setter.invoke(programInstance, value);
			} catch (IllegalAccessException | IllegalArgumentException e) {
				throw new RuntimeException("Error setting value \""+value+"\" for option \""+o.getId()+"\" of type: "+o.getType(),e);
			} catch (InvocationTargetException e) {
				throw new IllegalArgumentException("Invalid value \""+value+"\" for option \""+o.getId()+"\": "+e.getCause().getMessage(),e.getCause());
			}
			i++;
		}
		return i;
	}
}
