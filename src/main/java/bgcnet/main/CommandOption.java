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

import java.lang.reflect.Method;

/**
 * Option of a command. Values given in the command line are set on the program instance
 * through the setter of the attribute associated to the option
 * @author BGCNet developers
 *
 */
public class CommandOption {
	public static final String TYPE_INT = "INT";
	public static final String TYPE_DOUBLE = "DOUBLE";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_DIR = "DIR";
	public static final String TYPE_BOOLEAN = "BOOLEAN";

	private String id;
	private String type;
	private String defaultValue=null;
	private String description;
	private String attribute;

	public CommandOption(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public boolean isBoolean() {
		return TYPE_BOOLEAN.equals(type);
	}
	/**
	 * Finds the setter of the attribute in the given program. Setters receiving the type
	 * of the option are preferred over setters receiving a String
	 * @param instance Program instance
	 * @return Method setter for the attribute
	 */
	public Method findSetMethod (Object instance) {
		if(attribute==null) throw new RuntimeException("Attribute not set for option: "+id);
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		try {
			return instance.getClass().getMethod(methodName,getTypeClass());
		} catch (NoSuchMethodException | SecurityException e) {
			try {
				return instance.getClass().getMethod(methodName,String.class);
			} catch (NoSuchMethodException | SecurityException e1) {
				throw new RuntimeException("Program "+instance.getClass().getName()+" does not have a setter for option "+id,e);
			}
		}
	}
	private Class<?> getTypeClass() {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_DOUBLE.equals(type)) return Double.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type) || TYPE_DIR.equals(type)) return String.class;
		throw new RuntimeException("Can not decode option of unrecognized type: "+type);
	}
	public Object decodeValue (String value) {
		return OptionValuesDecoder.decode(value, getTypeClass());
	}
}
