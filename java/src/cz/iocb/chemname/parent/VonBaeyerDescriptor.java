package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;



/**
 * Bracketed von Baeyer descriptor: the two branches of the main ring, the main bridge and the secondary bridges with
 * the locants of their bridgeheads, e.g. [3.3.1.1<sup>3,7</sup>] written as "[3.3.1.13,7]".
 */
public final class VonBaeyerDescriptor implements Comparable<VonBaeyerDescriptor>
{
    public static final class Bridge implements Comparable<Bridge>
    {
        private final int length;
        private final int from;
        private final int to;


        public Bridge(int length, int from, int to)
        {
            this.length = length;
            this.from = Math.min(from, to);
            this.to = Math.max(from, to);
        }


        public int getLength()
        {
            return length;
        }


        public int getFrom()
        {
            return from;
        }


        public int getTo()
        {
            return to;
        }


        /**
         * Citation order: larger bridges first, then lower superscripts.
         */
        @Override
        public int compareTo(Bridge other)
        {
            if(length != other.length)
                return Integer.compare(other.length, length);

            if(from != other.from)
                return Integer.compare(from, other.from);

            return Integer.compare(to, other.to);
        }


        @Override
        public String toString()
        {
            return length + "" + from + "," + to;
        }
    }


    private final int mainRing;
    private final int largeBranch;
    private final int smallBranch;
    private final int mainBridge;
    private final List<Bridge> secondaryBridges;


    public VonBaeyerDescriptor(int largeBranch, int smallBranch, int mainBridge, List<Bridge> secondaryBridges)
    {
        List<Bridge> bridges = new ArrayList<Bridge>(secondaryBridges);
        Collections.sort(bridges);

        this.mainRing = largeBranch + smallBranch + 2;
        this.largeBranch = largeBranch;
        this.smallBranch = smallBranch;
        this.mainBridge = mainBridge;
        this.secondaryBridges = Collections.unmodifiableList(bridges);
    }


    public int getMainRingSize()
    {
        return mainRing;
    }


    public int getMainBridge()
    {
        return mainBridge;
    }


    public int getLargeBranch()
    {
        return largeBranch;
    }


    public int getSmallBranch()
    {
        return smallBranch;
    }


    public List<Bridge> getSecondaryBridges()
    {
        return secondaryBridges;
    }


    public int getRingCount()
    {
        return secondaryBridges.size() + 2;
    }


    public int getAtomCount()
    {
        int count = mainRing + mainBridge;

        for(Bridge bridge : secondaryBridges)
            count += bridge.getLength();

        return count;
    }


    /**
     * Orders descriptors by preference: larger main ring, larger main bridge, more symmetric division of the main
     * ring, larger secondary bridges, lower superscripts. Preferred descriptors compare lower.
     */
    @Override
    public int compareTo(VonBaeyerDescriptor other)
    {
        if(mainRing != other.mainRing)
            return Integer.compare(other.mainRing, mainRing);

        if(mainBridge != other.mainBridge)
            return Integer.compare(other.mainBridge, mainBridge);

        if(largeBranch != other.largeBranch)
            return Integer.compare(largeBranch, other.largeBranch);

        for(int i = 0; i < Math.min(secondaryBridges.size(), other.secondaryBridges.size()); i++)
        {
            int length = secondaryBridges.get(i).getLength();
            int otherLength = other.secondaryBridges.get(i).getLength();

            if(length != otherLength)
                return Integer.compare(otherLength, length);
        }

        for(int i = 0; i < Math.min(secondaryBridges.size(), other.secondaryBridges.size()); i++)
        {
            Bridge bridge = secondaryBridges.get(i);
            Bridge otherBridge = other.secondaryBridges.get(i);

            if(bridge.getFrom() != otherBridge.getFrom())
                return Integer.compare(bridge.getFrom(), otherBridge.getFrom());

            if(bridge.getTo() != otherBridge.getTo())
                return Integer.compare(bridge.getTo(), otherBridge.getTo());
        }

        return 0;
    }


    @Override
    public boolean equals(Object object)
    {
        return object instanceof VonBaeyerDescriptor && toString().equals(object.toString());
    }


    @Override
    public int hashCode()
    {
        return toString().hashCode();
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append('[').append(largeBranch).append('.').append(smallBranch).append('.').append(mainBridge);

        for(Bridge bridge : secondaryBridges)
            builder.append('.').append(bridge);

        return builder.append(']').toString();
    }
}
