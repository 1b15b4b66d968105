package cz.iocb.chemname.rules;



/**
 * Thrown when the nomenclature tables cannot be loaded or are inconsistent.
 */
public class NomenclatureTablesException extends RuntimeException
{
    private static final long serialVersionUID = 1L;


    public NomenclatureTablesException(String message)
    {
        super(message);
    }


    public NomenclatureTablesException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
