package cz.iocb.chemname.numbering;

import java.util.List;



/**
 * Position label within a parent structure: a number with an optional letter ("4a"), or a heteroatom label with
 * primes ("N", "N'") for positions outside the numbered skeleton.
 */
public final class Locant implements Comparable<Locant>
{
    private final int number;
    private final char letter;
    private final String element;
    private final int primes;


    private Locant(int number, char letter, String element, int primes)
    {
        this.number = number;
        this.letter = letter;
        this.element = element;
        this.primes = primes;
    }


    public static Locant of(int number)
    {
        if(number < 1)
            throw new IllegalArgumentException("locants are 1-based: " + number);

        return new Locant(number, (char) 0, null, 0);
    }


    public static Locant of(int number, char letter)
    {
        if(number < 1)
            throw new IllegalArgumentException("locants are 1-based: " + number);

        return new Locant(number, letter, null, 0);
    }


    public static Locant heteroatom(String element, int primes)
    {
        return new Locant(0, (char) 0, element, primes);
    }


    public static Locant parse(String text)
    {
        char last = text.charAt(text.length() - 1);

        if(Character.isLetter(last))
            return of(Integer.parseInt(text.substring(0, text.length() - 1)), last);
        else
            return of(Integer.parseInt(text));
    }


    public int getNumber()
    {
        return number;
    }


    public boolean isHeteroatom()
    {
        return element != null;
    }


    @Override
    public int compareTo(Locant other)
    {
        if(isHeteroatom() != other.isHeteroatom())
            return isHeteroatom() ? -1 : 1;

        if(isHeteroatom())
        {
            int result = element.compareTo(other.element);
            return result != 0 ? result : Integer.compare(primes, other.primes);
        }

        if(number != other.number)
            return Integer.compare(number, other.number);

        return Character.compare(letter, other.letter);
    }


    @Override
    public boolean equals(Object object)
    {
        if(!(object instanceof Locant))
            return false;

        return compareTo((Locant) object) == 0;
    }


    @Override
    public int hashCode()
    {
        return isHeteroatom() ? element.hashCode() * 31 + primes : number * 31 + letter;
    }


    @Override
    public String toString()
    {
        if(isHeteroatom())
        {
            StringBuilder builder = new StringBuilder(element);

            for(int i = 0; i < primes; i++)
                builder.append('\'');

            return builder.toString();
        }

        return letter == 0 ? Integer.toString(number) : Integer.toString(number) + letter;
    }


    public static String join(List<Locant> locants)
    {
        StringBuilder builder = new StringBuilder();

        for(Locant locant : locants)
        {
            if(builder.length() > 0)
                builder.append(',');

            builder.append(locant);
        }

        return builder.toString();
    }
}
