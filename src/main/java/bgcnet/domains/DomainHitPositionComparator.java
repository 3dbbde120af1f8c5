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
package bgcnet.domains;

import java.util.Comparator;

/**
 * Orders domain hits by their first coordinate. Hits with the same start are considered equal,
 * so stable sorts keep their input order
 * @author BGCNet developers
 *
 */
public class DomainHitPositionComparator implements Comparator<DomainHit> {

	private static DomainHitPositionComparator instance = new DomainHitPositionComparator();
	private DomainHitPositionComparator () {

	}
	@Override
	public int compare(DomainHit h0, DomainHit h1) {
		return Integer.compare(h0.getStart(), h1.getStart());
	}
	public static DomainHitPositionComparator getInstance() {
		return instance;
	}
}
