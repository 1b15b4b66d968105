package cz.iocb.chemname.molecule;



/**
 * Thrown when a molecule references atoms it does not contain.
 */
public class StructuralException extends Exception
{
    private static final long serialVersionUID = 1L;


    public StructuralException(String message)
    {
        super(message);
    }
}
