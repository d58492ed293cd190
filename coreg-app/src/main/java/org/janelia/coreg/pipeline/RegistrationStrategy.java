package org.janelia.coreg.pipeline;

import org.janelia.coreg.convert.CommandRunner;
import org.janelia.coreg.convert.FslConventionAdapter;
import org.janelia.coreg.convert.LtaConventionAdapter;
import org.janelia.coreg.convert.MatrixConventionAdapter;

/**
 * Supported pairs of refined and fallback registration methods.
 */
public enum RegistrationStrategy {

    /**
     * FreeSurfer bbregister (surface boundary based, LTA voxel convention)
     * checked against an mri_coreg registration with the same degrees of freedom.
     */
    BBREGISTER("bbregister", "mri_coreg") {
        @Override
        public MatrixConventionAdapter buildAdapter(final CommandRunner commandRunner) {
            return new LtaConventionAdapter(commandRunner);
        }
    },

    /**
     * FSL FLIRT with the BBR cost function (intensity boundary based, FSL convention)
     * checked against the rigid FLIRT registration used to initialize it.
     */
    FLIRT_BBR("flt_bbr", "flt_bbr_init") {
        @Override
        public MatrixConventionAdapter buildAdapter(final CommandRunner commandRunner) {
            return new FslConventionAdapter(commandRunner);
        }

        @Override
        public int getFallbackDof(final int dof) {
            return RIGID_DOF;
        }
    };

    public static final int RIGID_DOF = 6;

    private final String refinedName;
    private final String fallbackName;

    RegistrationStrategy(final String refinedName,
                         final String fallbackName) {
        this.refinedName = refinedName;
        this.fallbackName = fallbackName;
    }

    public String getRefinedName() {
        return refinedName;
    }

    public String getFallbackName() {
        return fallbackName;
    }

    /**
     * @return degrees of freedom used by the fallback registration when the refined registration uses dof.
     */
    public int getFallbackDof(final int dof) {
        return dof;
    }

    public abstract MatrixConventionAdapter buildAdapter(final CommandRunner commandRunner);
}
