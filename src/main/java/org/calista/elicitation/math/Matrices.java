package org.calista.elicitation.math;

import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.decomposition.CholeskyDecomposition_F64;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;

import java.util.Arrays;
import java.util.Objects;

/**
 * Small dense helpers over EJML for the 7x7 posterior / information matrices.
 *
 * <p>All methods are pure: inputs are never modified, results are fresh matrices.</p>
 */
public final class Matrices {

    private Matrices() {}

    // ---------------------------------------------------------------------
    // Construction / conversion
    // ---------------------------------------------------------------------

    public static DMatrixRMaj zeros(int n) {
        return new DMatrixRMaj(n, n);
    }

    public static DMatrixRMaj diagonal(int n, double value) {
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) m.set(i, i, value);
        return m;
    }

    public static DMatrixRMaj of(double[][] rows) {
        Objects.requireNonNull(rows, "rows");
        return new DMatrixRMaj(rows);
    }

    public static double[][] toArray(DMatrixRMaj m) {
        Objects.requireNonNull(m, "m");
        double[][] out = new double[m.numRows][m.numCols];
        for (int r = 0; r < m.numRows; r++) {
            for (int c = 0; c < m.numCols; c++) out[r][c] = m.get(r, c);
        }
        return out;
    }

    public static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = Arrays.copyOf(a[i], a[i].length);
        return out;
    }

    // ---------------------------------------------------------------------
    // Vector ops
    // ---------------------------------------------------------------------

    public static double dot(double[] a, double[] b) {
        requireSameLength(a, b);
        double s = 0.0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    public static double[] subtract(double[] a, double[] b) {
        requireSameLength(a, b);
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i] - b[i];
        return out;
    }

    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /** weight * x x^T */
    public static DMatrixRMaj outer(double[] x, double weight) {
        int n = x.length;
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) m.set(r, c, weight * x[r] * x[c]);
        }
        return m;
    }

    public static double[] multiply(DMatrixRMaj m, double[] x) {
        if (m.numCols != x.length) throw new IllegalArgumentException("dimension mismatch: " + m.numCols + " vs " + x.length);
        double[] out = new double[m.numRows];
        for (int r = 0; r < m.numRows; r++) {
            double s = 0.0;
            for (int c = 0; c < m.numCols; c++) s += m.get(r, c) * x[c];
            out[r] = s;
        }
        return out;
    }

    /** x^T M x */
    public static double quadraticForm(DMatrixRMaj m, double[] x) {
        return dot(x, multiply(m, x));
    }

    // ---------------------------------------------------------------------
    // Matrix ops
    // ---------------------------------------------------------------------

    public static DMatrixRMaj add(DMatrixRMaj a, DMatrixRMaj b) {
        DMatrixRMaj out = new DMatrixRMaj(a.numRows, a.numCols);
        CommonOps_DDRM.add(a, b, out);
        return out;
    }

    public static DMatrixRMaj addDiagonal(DMatrixRMaj a, double value) {
        DMatrixRMaj out = a.copy();
        int n = Math.min(a.numRows, a.numCols);
        for (int i = 0; i < n; i++) out.add(i, i, value);
        return out;
    }

    public static DMatrixRMaj symmetrize(DMatrixRMaj a) {
        DMatrixRMaj t = new DMatrixRMaj(a.numCols, a.numRows);
        CommonOps_DDRM.transpose(a, t);
        DMatrixRMaj out = add(a, t);
        CommonOps_DDRM.scale(0.5, out);
        return out;
    }

    public static double determinant(DMatrixRMaj a) {
        return CommonOps_DDRM.det(a);
    }

    public static double trace(DMatrixRMaj a) {
        return CommonOps_DDRM.trace(a);
    }

    public static double[] diag(DMatrixRMaj a) {
        int n = Math.min(a.numRows, a.numCols);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = a.get(i, i);
        return out;
    }

    public static int rank(DMatrixRMaj a) {
        return MatrixFeatures_DDRM.rank(a.copy());
    }

    /**
     * Eigenvalues of a symmetric matrix, ascending.
     */
    public static double[] symmetricEigenvalues(DMatrixRMaj a) {
        DMatrixRMaj s = symmetrize(a);
        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(s.numRows, false, true);
        if (!eig.decompose(s)) throw new ArithmeticException("eigen decomposition failed");
        double[] out = new double[eig.getNumberOfEigenvalues()];
        for (int i = 0; i < out.length; i++) {
            Complex_F64 v = eig.getEigenvalue(i);
            out[i] = v.getReal();
        }
        Arrays.sort(out);
        return out;
    }

    /**
     * Inverse of a symmetric positive definite matrix via Cholesky.
     *
     * @return inverse, or null when the matrix is not (numerically) positive definite
     */
    public static DMatrixRMaj invertSpd(DMatrixRMaj a) {
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.chol(a.numRows);
        if (!solver.setA(a.copy())) return null;
        DMatrixRMaj inv = new DMatrixRMaj(a.numRows, a.numCols);
        solver.invert(inv);
        if (MatrixFeatures_DDRM.hasUncountable(inv)) return null;
        return symmetrize(inv);
    }

    /**
     * Lower Cholesky factor L with A = L L^T.
     *
     * @return L, or null when the matrix is not (numerically) positive definite
     */
    public static DMatrixRMaj choleskyLower(DMatrixRMaj a) {
        CholeskyDecomposition_F64<DMatrixRMaj> chol = DecompositionFactory_DDRM.chol(a.numRows, true);
        if (!chol.decompose(a.copy())) return null;
        DMatrixRMaj l = chol.getT(null);
        if (MatrixFeatures_DDRM.hasUncountable(l)) return null;
        return l;
    }

    /**
     * Solves A x = b for symmetric positive definite A via Cholesky.
     *
     * @return solution, or null when A is not (numerically) positive definite
     */
    public static double[] solveSpd(DMatrixRMaj a, double[] b) {
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.chol(a.numRows);
        if (!solver.setA(a.copy())) return null;
        DMatrixRMaj rhs = new DMatrixRMaj(b.length, 1, true, b);
        DMatrixRMaj x = new DMatrixRMaj(b.length, 1);
        solver.solve(rhs, x);
        for (int i = 0; i < b.length; i++) {
            if (!Double.isFinite(x.get(i, 0))) return null;
        }
        return Arrays.copyOf(x.data, b.length);
    }

    private static void requireSameLength(double[] a, double[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length != b.length) throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
    }
}
