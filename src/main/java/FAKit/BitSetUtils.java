package FAKit;

import FAKit.Model.EpsilonNFA;

import java.util.BitSet;
import java.util.StringJoiner;

public class BitSetUtils {
    /**
     * Determine is sub is a subset of sup.
     */
    public static boolean isSubset(BitSet sub, BitSet sup) {
        for(int i=sub.nextSetBit(0);i>=0;i=sub.nextSetBit(i+1)) {
            if(!sup.get(i)) {
                return false;
            }
        }
        return true;
    }

    public static BitSet of(int... states) {
        BitSet set = new BitSet();
        for (int s : states) {
            set.set(s);
        }
        return set;
    }

    /**
     * Render a set of NFA states as "{q0, q2}", or "∅" when empty.
     */
    public static String toStateString(BitSet states) {
        if (states.isEmpty()) {
            return "∅";
        }
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for(int i=states.nextSetBit(0);i>=0;i=states.nextSetBit(i+1)) {
            joiner.add(EpsilonNFA.stateName(i));
        }
        return joiner.toString();
    }
}
