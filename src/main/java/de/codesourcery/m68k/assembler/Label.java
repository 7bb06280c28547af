package de.codesourcery.m68k.assembler;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.ast.LabelNode;
import de.codesourcery.m68k.utils.Misc;

/**
 * A label together with the address it was assembled to.
 */
public final class Label
{
	public final LabelNode node;
	public final String name;
	public final String parentName;
	public final int address;

	/**
	 *
	 * @param node
	 * @param parentName name of the global label a local label belongs to, <code>null</code> for global labels
	 * @param address
	 */
	public Label(LabelNode node,String parentName,int address)
	{
		Validate.notNull( node , "node must not be NULL");
		if ( node.isLocal() ) {
			Validate.notNull( parentName , "parentName must not be NULL for local labels");
		} else {
			Validate.isTrue( parentName == null , "global labels have no parent");
		}
		this.node = node;
		this.name = node.name;
		this.parentName = parentName;
		this.address = address;
	}

	public boolean isLocal() {
		return parentName != null;
	}

	public boolean isGlobal() {
		return parentName == null;
	}

	@Override
	public String toString() {
		return isGlobal() ? "global label '"+name+"' @ "+Misc.to32BitHex( address ) : "local label '"+name+"' @ "+Misc.to32BitHex( address )+" , child of '"+parentName+"'";
	}
}
