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
package bgcnet.domains.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.LinkedHashMap;
import java.util.Map;

import bgcnet.main.io.ParseUtils;

/**
 * Loads the group label (usually the product class) of each cluster from a tab-delimited
 * file with the cluster id in the first column and the group in the second column
 * @author BGCNet developers
 *
 */
public class ClusterGroupsFileHandler {
	public static final String UNKNOWN_GROUP = "NA";

	public Map<String, String> loadGroups(String filename) throws IOException {
		try (FileInputStream fis = new FileInputStream(filename)) {
			return loadGroups(fis);
		}
	}
	public Map<String, String> loadGroups(InputStream is) throws IOException {
		Map<String, String> groups = new LinkedHashMap<>();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(is))) {
			String line=in.readLine();
			while (line!=null) {
				if(line.trim().length()>0 && line.charAt(0)!='#') {
					String [] items = ParseUtils.parseString(line, '\t');
					String group = UNKNOWN_GROUP;
					if(items.length>1 && items[1].trim().length()>0) group = items[1].trim();
					groups.put(items[0].trim(), group);
				}
				line=in.readLine();
			}
		}
		return groups;
	}
}
