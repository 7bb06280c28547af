package de.codesourcery.m68k.parser.ast;

import java.util.Objects;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.Location;

public final class CommentNode extends Statement
{
	public final String comment;

	public CommentNode(Location location,String comment)
	{
		super(location);
		Validate.notNull( comment , "comment must not be NULL");
		this.comment = comment;
	}

	@Override
	public Type getType() {
		return Type.COMMENT;
	}

	@Override
	public String toString() {
		return "Comment: \""+comment+"\"";
	}

	@Override
	public String toAlignedString() {
		return "; "+comment;
	}

	@Override
	public int hashCode() {
		return Objects.hash( getType() , location , comment );
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof CommentNode )
		{
			final CommentNode other = (CommentNode) obj;
			return location.equals( other.location ) && comment.equals( other.comment );
		}
		return false;
	}
}
