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
package bgcnet.main.io;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ParseUtils {
	public static final DecimalFormat ENGLISHFMT = new DecimalFormat("0.0#####",DecimalFormatSymbols.getInstance(Locale.ENGLISH));
	public static final String INFINITY = "inf";

	/**
	 * Parse the given string sequence looking for a single delimiter. Empty tokens are kept
	 * @param s The string to parse
	 * @param delim Parsing delimiter
	 * @return String [] Array of strings with the identified tokens
	 */
	public static String[] parseString(String s,char delim) {
		List<String> answer = new ArrayList<String>();
		char [] a = s.toCharArray();
		StringBuilder current = new StringBuilder(a.length);
		for (int i=0;i<a.length;i++) {
			if(a[i] == delim) {
				answer.add(current.toString());
				current = new StringBuilder(a.length);
				continue;
			}
			current.append(a[i]);
		}
		answer.add(current.toString());
		return answer.toArray(new String[0]);
	}
	/**
	 * Parse a comma separated list of numbers
	 * @param s String to parse
	 * @return double [] parsed values
	 * @throws NumberFormatException If one of the values is not a number
	 */
	public static double [] parseDoubles(String s) {
		String [] items = parseString(s, ',');
		double [] answer = new double[items.length];
		for(int i=0;i<items.length;i++) {
			answer[i] = Double.parseDouble(items[i].trim());
		}
		return answer;
	}
	/**
	 * Formats the given number with up to six decimals and english symbols
	 * @param value to format
	 * @return String formatted value. Positive infinity is written as inf
	 */
	public static String formatNumber(double value) {
		if(value == Double.POSITIVE_INFINITY) return INFINITY;
		if(value == Double.NEGATIVE_INFINITY) return "-"+INFINITY;
		synchronized (ENGLISHFMT) {
			return ENGLISHFMT.format(value);
		}
	}
}
