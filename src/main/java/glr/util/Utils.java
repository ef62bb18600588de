package glr.util;

import java.util.ArrayList;
import java.util.Collection;

/**
 * Small collection helpers
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a collection.
	 *
	 * @param strs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : strs){
			if (!first){
				builder.append(separator);
			}
			builder.append(obj);
			first = false;
		}
		return builder.toString();
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> ret = new ArrayList<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}
}
