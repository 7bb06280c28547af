package de.codesourcery.m68k.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.Validate;

/**
 * A parsed source file.
 *
 * Holds the statements in source order and, for every label, the index of the
 * statement the label points to.
 */
public final class Program
{
	private final List<Statement> statements;
	private final Map<LabelNode,Integer> labelsToIndex;

	public Program(List<Statement> statements,Map<LabelNode,Integer> labelsToIndex)
	{
		Validate.notNull( statements , "statements must not be NULL");
		Validate.notNull( labelsToIndex , "labelsToIndex must not be NULL");
		for ( Map.Entry<LabelNode,Integer> entry : labelsToIndex.entrySet() )
		{
			final int index = entry.getValue();
			if ( index < 0 || index >= statements.size() ) {
				throw new IllegalArgumentException("Label "+entry.getKey()+" points to statement #"+index+" but there are only "+statements.size()+" statements");
			}
		}
		this.statements = Collections.unmodifiableList( new ArrayList<>( statements ) );
		this.labelsToIndex = Collections.unmodifiableMap( new LinkedHashMap<>( labelsToIndex ) );
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public Statement statement(int index) {
		return statements.get( index );
	}

	public int getStatementCount() {
		return statements.size();
	}

	/**
	 * Returns all labels and the index of the statement each of them points to,
	 * in source order.
	 *
	 * @return
	 */
	public Map<LabelNode,Integer> getLabelsToIndex() {
		return labelsToIndex;
	}

	/**
	 * Returns the labels pointing to a given statement, in source order.
	 *
	 * @param statementIndex
	 * @return
	 */
	public List<LabelNode> getLabelsAt(int statementIndex)
	{
		final List<LabelNode> result = new ArrayList<>();
		for ( Map.Entry<LabelNode,Integer> entry : labelsToIndex.entrySet() ) {
			if ( entry.getValue() == statementIndex ) {
				result.add( entry.getKey() );
			}
		}
		return result;
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder();
		for ( int i = 0 ; i < statements.size() ; i++ )
		{
			for ( LabelNode label : getLabelsAt( i ) ) {
				buffer.append( label.toAlignedString() ).append("\n");
			}
			final Statement stmt = statements.get(i);
			if ( stmt.hasType( Statement.Type.INSTRUCTION ) ) {
				buffer.append("    ");
			}
			buffer.append( stmt.toAlignedString() ).append("\n");
		}
		return buffer.toString();
	}
}
