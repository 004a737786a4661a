package com.brewuv.solver;

/**
 * Theoretical direct, diffuse and global irradiance for one geometry and atmosphere.
 */
public interface IrradianceSolver {

    SolverResult solve(SolverRequest request) throws SolverException;
}
