package de.codesourcery.m68k.assembler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps addresses of generated code back to source lines.
 */
public class SourceMap
{
	private final List<RangeWithLine> ranges = new ArrayList<>();

	protected static final class RangeWithLine
	{
		public final int start;
		public final int length;
		public final int lineNo;

		public RangeWithLine(int start, int length, int lineNo) {
			this.start = start;
			this.length = length;
			this.lineNo = lineNo;
		}

		public boolean contains(int adr) {
			return adr >= start && adr < start + length;
		}

		@Override
		public String toString() {
			return "Line no. "+lineNo+" is at "+start+" (length "+length+")";
		}
	}

	public void addAddressRange(int start,int len, int lineNo)
	{
		ranges.add( new RangeWithLine( start , len , lineNo ) );
	}

	public Optional<Integer> getLineNumberForAddress(int adr)
	{
		for ( RangeWithLine r : ranges ) {
			if ( r.contains( adr ) ) {
				return Optional.of( r.lineNo );
			}
		}
		return Optional.empty();
	}
}
