package cz.iocb.chemname.molecule;



public class AtomicNumbers
{
    public static final byte C = 6;
    public static final byte N = 7;
    public static final byte O = 8;
    public static final byte F = 9;
    public static final byte S = 16;
    public static final byte Cl = 17;
    public static final byte Br = 35;
    public static final byte I = 53;

    public static final byte UNKNOWN = -'?';
}
