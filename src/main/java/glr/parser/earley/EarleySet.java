package glr.parser.earley;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The items of one input position in insertion order
 */
public class EarleySet {

	public final int position;

	private final List<EarleyItem> items = new ArrayList<>();

	private final Set<EarleyItem> itemSet = new HashSet<>();

	public EarleySet(int position){
		this.position = position;
	}

	/**
	 * @return true if the item is new
	 */
	public boolean add(EarleyItem item){
		if (itemSet.add(item)){
			items.add(item);
			return true;
		}
		return false;
	}

	public EarleyItem get(int index){
		return items.get(index);
	}

	public int size(){
		return items.size();
	}

	public boolean contains(EarleyItem item){
		return itemSet.contains(item);
	}

	public List<EarleyItem> getItems() {
		return items;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int j = 0; j < items.size(); j++) {
			if (j != 0){
				builder.append("\n");
			}
			builder.append("- ").append(items.get(j));
		}
		return builder.toString();
	}
}
