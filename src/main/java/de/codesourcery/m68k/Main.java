package de.codesourcery.m68k;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang.StringUtils;

import de.codesourcery.m68k.assembler.Assembler;
import de.codesourcery.m68k.assembler.Label;
import de.codesourcery.m68k.assembler.SymbolTable;
import de.codesourcery.m68k.parser.CompilationError;
import de.codesourcery.m68k.parser.ErrorCollector;
import de.codesourcery.m68k.parser.IErrorCollector;
import de.codesourcery.m68k.parser.Lexer;
import de.codesourcery.m68k.parser.Parser;
import de.codesourcery.m68k.parser.Token;
import de.codesourcery.m68k.parser.ast.LabelNode;
import de.codesourcery.m68k.parser.ast.Program;
import de.codesourcery.m68k.parser.ast.Statement;
import de.codesourcery.m68k.utils.HexDump;

/**
 * Command line front end.
 *
 * <pre>
 * Main [-o output] [-origin $hex] [-listing] [-v] file.s
 * </pre>
 */
public class Main
{
	private static final String USAGE = "Usage: [-o output] [-origin $hex] [-listing] [-v] file.s";

	private final PrintStream out;
	private final PrintStream err;

	private File inputFile;
	private File outputFile;
	private int origin = Constants.DEFAULT_ORIGIN;
	private boolean listing;
	private boolean verbose;

	public Main(PrintStream out,PrintStream err)
	{
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args)
	{
		System.exit( new Main( System.out , System.err ).run( args ) );
	}

	/**
	 * Assembles the file named on the command line.
	 *
	 * @param args
	 * @return process exit code, 0 on success
	 */
	public int run(String[] args)
	{
		try
		{
			parseArguments( args );
		}
		catch(IllegalArgumentException e)
		{
			err.println( e.getMessage() );
			err.println( USAGE );
			return 1;
		}

		final String source;
		try {
			source = FileUtils.readFileToString( inputFile , Constants.SOURCE_ENCODING );
		}
		catch(IOException e)
		{
			err.println("Failed to read "+inputFile+": "+e.getMessage());
			return 1;
		}

		final IErrorCollector errors = new ErrorCollector();
		final List<Token> tokens = Lexer.tokenize( source , errors );

		final Parser parser = new Parser( errors );
		parser.setDebug( verbose );
		final Program program = parser.parse( tokens );

		final Assembler assembler = new Assembler();
		assembler.setDebug( verbose );
		assembler.setOrigin( origin );
		final byte[] binary = assembler.assemble( program , errors );

		if ( errors.hasErrors() )
		{
			for ( CompilationError error : errors.getErrors() ) {
				err.println( inputFile.getName()+":"+error.location.line+":"+error.location.column+": "+error.message );
			}
			return 1;
		}

		try {
			FileUtils.writeByteArrayToFile( outputFile , binary );
		}
		catch(IOException e)
		{
			err.println("Failed to write "+outputFile+": "+e.getMessage());
			return 1;
		}

		if ( verbose ) {
			out.println("Wrote "+binary.length+" bytes to "+outputFile);
		}
		if ( listing )
		{
			out.println( createListing( program , assembler , binary ) );
			out.println( createSymbolListing( assembler.getSymbolTable() ) );
		}
		return 0;
	}

	private void parseArguments(String[] args)
	{
		for ( int i = 0 ; i < args.length ; i++ )
		{
			final String arg = args[i];
			switch( arg )
			{
				case "-o":
					outputFile = new File( argumentValue( args , ++i , arg ) );
					break;
				case "-origin":
					origin = parseOrigin( argumentValue( args , ++i , arg ) );
					break;
				case "-listing":
					listing = true;
					break;
				case "-v":
					verbose = true;
					break;
				default:
					if ( arg.startsWith("-") ) {
						throw new IllegalArgumentException("Unknown option "+arg);
					}
					if ( inputFile != null ) {
						throw new IllegalArgumentException("Only one source file may be given");
					}
					inputFile = new File( arg );
			}
		}
		if ( inputFile == null ) {
			throw new IllegalArgumentException("No source file given");
		}
		if ( outputFile == null )
		{
			final String baseName = FilenameUtils.removeExtension( inputFile.getPath() );
			outputFile = new File( baseName + Constants.DEFAULT_OUTPUT_SUFFIX );
		}
	}

	private static String argumentValue(String[] args,int index,String option)
	{
		if ( index >= args.length ) {
			throw new IllegalArgumentException("Option "+option+" requires an argument");
		}
		return args[index];
	}

	private static int parseOrigin(String value)
	{
		final String hex = StringUtils.removeStart( value , "$" );
		final long result;
		try {
			result = Long.parseLong( hex , 16 );
		}
		catch(NumberFormatException e) {
			throw new IllegalArgumentException("Invalid origin "+value+", expected a hexadecimal address like $1000");
		}
		if ( result > 0xffffffffL ) {
			throw new IllegalArgumentException("Origin "+value+" does not fit into 32 bits");
		}
		if ( (result & 1) != 0 ) {
			throw new IllegalArgumentException("Origin "+value+" must be word-aligned");
		}
		return (int) result;
	}

	/*
	 * address: words    statement
	 */
	private static String createListing(Program program,Assembler assembler,byte[] binary)
	{
		final StringBuilder buffer = new StringBuilder();
		final int count = program.getStatementCount();
		for ( int i = 0 ; i < count ; i++ )
		{
			final int address = assembler.getAddress( i );
			for ( LabelNode label : program.getLabelsAt( i ) ) {
				buffer.append( HexDump.toAdr( address ) ).append(": ").append( StringUtils.repeat(" ", 20 ) ).append( label.toAlignedString() ).append("\n");
			}
			final Statement stmt = program.statement( i );
			final int start = address - assembler.getOrigin();
			final int end = i+1 < count ? assembler.getAddress( i+1 ) - assembler.getOrigin() : binary.length;
			final String words = HexDump.toWords( binary , start , end - start );
			buffer.append( HexDump.toAdr( address ) ).append(": ").append( StringUtils.rightPad( words , 20 ) );
			if ( stmt.hasType( Statement.Type.INSTRUCTION ) ) {
				buffer.append("    ");
			}
			buffer.append( stmt.toAlignedString() ).append("\n");
		}
		return buffer.toString();
	}

	/*
	 * Global labels by address, each followed by its local labels.
	 */
	private static String createSymbolListing(SymbolTable table)
	{
		final StringBuilder buffer = new StringBuilder("=== Symbol table ===\n");
		final List<Label> globals = table.getGlobalSymbols();
		globals.sort( Comparator.comparingInt( l -> l.address ) );
		for ( Label global : globals )
		{
			buffer.append( HexDump.toAdr( global.address ) ).append(": ").append( global.name ).append("\n");
			final List<Label> locals = table.getLocalSymbols( global.name );
			locals.sort( Comparator.comparingInt( l -> l.address ) );
			for ( Label local : locals ) {
				buffer.append( HexDump.toAdr( local.address ) ).append(":     ").append( local.name ).append("\n");
			}
		}
		return buffer.toString();
	}
}
