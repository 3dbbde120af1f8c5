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

public class OptionValuesDecoder {
	public static Object decode (String value, Class<?> type) {
		if(Integer.class.equals(type)) {
			return Integer.parseInt(value);
		}
		if(Double.class.equals(type)) {
			return Double.parseDouble(value);
		}
		if(Boolean.class.equals(type)) {
			return Boolean.parseBoolean(value);
		}
		if(String.class.equals(type)) {
			return value;
		}
		throw new IllegalArgumentException("Can not decode value of type: "+type.toString());
	}
}
