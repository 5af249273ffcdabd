// This file is part of the GR1Synth toolchain (gr1s).
//
// GR1Synth is free software; you can redistribute it and/or
// modify it under the terms of the GNU General Public License
// as published by the Free Software Foundation; either version 3
// of the License, or (at your option) any later version.
//
// GR1Synth is distributed in the hope that it will be useful,
// but WITHOUT ANY WARRANTY; without even the implied warranty of
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
// GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with GR1Synth. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, The GR1Synth Developers.
package gr1synth.extensions;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A partition of a continuous state space into regions, where each region
 * decides every proposition of interest one way. Regions are numbered from
 * zero, and the adjacency relation records which region can be reached from
 * which in one step.
 *
 */
public final class PropPreservingPartition {
	private final ImmutableList<String> propositions;
	private final ImmutableList<ImmutableSet<String>> regions;
	private final boolean[][] adjacency;

	/**
	 * @param propositions
	 *            The propositions the partition preserves.
	 * @param regions
	 *            For each region, the propositions holding in it.
	 * @param adjacency
	 *            <code>adjacency[i][j]</code> holds when region
	 *            <code>j</code> is reachable from region <code>i</code>.
	 */
	public PropPreservingPartition(List<String> propositions, List<? extends Set<String>> regions,
			boolean[][] adjacency) {
		this.propositions = ImmutableList.copyOf(propositions);
		ImmutableList.Builder<ImmutableSet<String>> rs = ImmutableList.builder();
		for (Set<String> r : regions) {
			checkArgument(this.propositions.containsAll(r), "region uses unknown propositions %s", r);
			rs.add(ImmutableSet.copyOf(r));
		}
		this.regions = rs.build();
		checkArgument(adjacency.length == regions.size(), "adjacency has %s rows for %s regions",
				adjacency.length, regions.size());
		this.adjacency = new boolean[adjacency.length][];
		for (int i = 0; i != adjacency.length; ++i) {
			checkArgument(adjacency[i].length == regions.size(), "adjacency row %s has %s entries", i,
					adjacency[i].length);
			this.adjacency[i] = adjacency[i].clone();
		}
	}

	public ImmutableList<String> propositions() {
		return propositions;
	}

	public int size() {
		return regions.size();
	}

	public ImmutableSet<String> propositionsOf(int region) {
		return regions.get(region);
	}

	public boolean isAdjacent(int from, int to) {
		return adjacency[from][to];
	}
}
