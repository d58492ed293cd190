package org.janelia.coreg.client.parameter;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.ParameterException;

/**
 * Only rigid (6), rigid plus scale (9) and full affine (12) registrations are supported.
 */
public class DofValidator
        implements IParameterValidator {

    @Override
    public void validate(final String name,
                         final String value)
            throws ParameterException {
        if (! ("6".equals(value) || "9".equals(value) || "12".equals(value))) {
            throw new ParameterException("parameter " + name + " must be 6, 9 or 12 (found " + value + ")");
        }
    }
}
