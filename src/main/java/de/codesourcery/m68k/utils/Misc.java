package de.codesourcery.m68k.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.lang.StringUtils;

public class Misc
{
    public static String to32BitHex(int value) {
        return "$"+StringUtils.leftPad( Integer.toHexString( value ) , 8 , '0' );
    }

    public static String join(Collection<?> items,String separator) {
    	return StringUtils.join( items , separator );
    }

    /**
     * Joins items the way an English sentence lists them: <code>a, b and c</code>.
     *
     * @param items
     * @return
     */
    public static String toReadableList(Collection<?> items)
    {
    	final List<Object> list = new ArrayList<>( items );
    	switch( list.size() )
    	{
    		case 0: return "";
    		case 1: return String.valueOf( list.get(0) );
    		default:
    			return StringUtils.join( list.subList( 0 , list.size() - 1 ) , ", " )+" and "+list.get( list.size() - 1 );
    	}
    }
}
