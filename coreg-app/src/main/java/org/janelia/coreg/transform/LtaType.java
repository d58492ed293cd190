package org.janelia.coreg.transform;

/**
 * Space a FreeSurfer linear transform array maps between, as recorded by its "type = N" line.
 * Matrices of different types are not comparable.
 */
public enum LtaType {

    VOX_TO_VOX(0),
    RAS_TO_RAS(1),
    PHYSVOX_TO_PHYSVOX(2),
    CORONAL_RAS_TO_CORONAL_RAS(21);

    private final int code;

    LtaType(final int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @throws IllegalArgumentException
     *   if the code is not a linear transform type.
     */
    public static LtaType fromCode(final int code)
            throws IllegalArgumentException {
        for (final LtaType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported LTA type " + code);
    }
}
