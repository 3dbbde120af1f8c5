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
package bgcnet.distances.io;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import bgcnet.distances.DomainDistanceMatrix;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;

/**
 * Builds domain distance matrices from multiple alignments of the domain instances of each family.
 * Each alignment is a fasta file named after the domain family, whose sequence names are the
 * instance ids of the domains. The dissimilarity between two instances is one minus the fraction
 * of identical aligned residues
 * @author BGCNet developers
 *
 */
public class DomainAlignmentsDistanceLoader {
	public static final String [] ALIGNMENT_EXTENSIONS = {".fasta",".fa"};
	public static final char GAP_CHARACTER = '-';

	private Logger log = Logger.getLogger(DomainAlignmentsDistanceLoader.class.getName());

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Loads the alignments of every domain family found in the given directory
	 * @param directory Directory with one alignment file per family
	 * @return DomainDistanceMatrix dissimilarities of all pairs of aligned instances
	 * @throws IOException If the directory or one of the alignments can not be read
	 */
	public DomainDistanceMatrix loadDirectory(String directory) throws IOException {
		DomainDistanceMatrix.Builder builder = new DomainDistanceMatrix.Builder();
		List<Path> files = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(directory))) {
			for(Path file:stream) {
				if(getFamilyName(file)!=null) files.add(file);
			}
		}
		files.sort((p1,p2)->p1.getFileName().toString().compareTo(p2.getFileName().toString()));
		for(Path file:files) {
			String family = getFamilyName(file);
			int pairs = loadFamilyAlignment(family, file, builder);
			log.info("Loaded "+pairs+" distances for domain family "+family+" from "+file);
		}
		return builder.build();
	}

	/**
	 * Calculates the dissimilarities between all pairs of sequences of one family alignment
	 * @param family Name of the domain family
	 * @param alignmentFile Fasta file with the aligned instances
	 * @param builder Builder receiving the dissimilarities
	 * @return int number of pairs loaded
	 * @throws IOException If the file can not be read or the aligned sequences have different lengths
	 */
	public int loadFamilyAlignment(String family, Path alignmentFile, DomainDistanceMatrix.Builder builder) throws IOException {
		List<ReferenceSequence> sequences = new ArrayList<>();
		try (FastaSequenceFile reader = new FastaSequenceFile(alignmentFile, true)) {
			ReferenceSequence seq = reader.nextSequence();
			while (seq!=null) {
				sequences.add(seq);
				seq = reader.nextSequence();
			}
		}
		int pairs = 0;
		for(int i=0;i<sequences.size();i++) {
			String name1 = sequences.get(i).getName();
			String aligned1 = sequences.get(i).getBaseString();
			for(int j=i+1;j<sequences.size();j++) {
				String name2 = sequences.get(j).getName();
				String aligned2 = sequences.get(j).getBaseString();
				if(aligned1.length()!=aligned2.length()) {
					throw new IOException("Aligned sequences "+name1+" and "+name2+" in file "+alignmentFile+" have different lengths: "+aligned1.length()+" and "+aligned2.length()+". Check for duplicated sequence names");
				}
				double identity = calculateIdentity(aligned1, aligned2);
				builder.put(family, name1, name2, 1-identity);
				pairs++;
			}
		}
		return pairs;
	}

	/**
	 * Calculates the fraction of identical residues between two aligned sequences.
	 * Columns with gaps in both sequences are not counted as matches. The length of the aligned
	 * region is the minimum of the lengths of both sequences after removing gaps at the ends
	 * @param aligned1 First aligned sequence
	 * @param aligned2 Second aligned sequence. Must have the same length of the first sequence
	 * @return double identity between 0 and 1
	 */
	public static double calculateIdentity(CharSequence aligned1, CharSequence aligned2) {
		int alignedLength = Math.min(getTrimmedLength(aligned1), getTrimmedLength(aligned2));
		if(alignedLength==0) return 0;
		int matches = 0;
		for(int i=0;i<aligned1.length();i++) {
			char c1 = Character.toUpperCase(aligned1.charAt(i));
			char c2 = Character.toUpperCase(aligned2.charAt(i));
			if(c1==c2 && c1!=GAP_CHARACTER) matches++;
		}
		return Math.min(1.0, (double)matches/alignedLength);
	}

	private static int getTrimmedLength(CharSequence aligned) {
		int first = 0;
		int last = aligned.length()-1;
		while(first<=last && aligned.charAt(first)==GAP_CHARACTER) first++;
		while(last>=first && aligned.charAt(last)==GAP_CHARACTER) last--;
		return last-first+1;
	}

	private static String getFamilyName(Path file) {
		String name = file.getFileName().toString();
		for(String extension:ALIGNMENT_EXTENSIONS) {
			if(name.endsWith(extension) && name.length()>extension.length()) return name.substring(0, name.length()-extension.length());
		}
		return null;
	}
}
