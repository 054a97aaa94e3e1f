package com.questrail.fits.wcs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TransformMatrixTest
{
    @Test
    void cdeltWithoutRotationIsDiagonal()
    {
        TransformMatrix m = TransformMatrix.fromCdelt(-0.001, 0.002, 0.0);

        assertEquals(-0.001, m.cd11(), 1e-15);
        assertEquals(0.0, m.cd12(), 1e-15);
        assertEquals(0.0, m.cd21(), 1e-15);
        assertEquals(0.002, m.cd22(), 1e-15);
    }

    @Test
    void rotationByNinetyDegrees()
    {
        TransformMatrix m = TransformMatrix.fromCdelt(1.0, 1.0, 90.0);
        TangentPlaneOffset t = m.transform(1.0, 0.0);

        assertEquals(0.0, t.x(), 1e-12);
        assertEquals(1.0, t.y(), 1e-12);
    }

    @Test
    void inverseUndoesTransform()
    {
        TransformMatrix m = new TransformMatrix(-2.5e-4, 1.0e-5, 1.2e-5, 2.6e-4);
        TangentPlaneOffset t = m.transform(123.0, -45.0);

        PixelCoordinate p = m.inverseTransform(t.x(), t.y(), new PixelScale(1, 1));

        assertEquals(123.0, p.x(), 1e-8);
        assertEquals(-45.0, p.y(), 1e-8);
    }

    @Test
    void singularMatrixFallsBackToScale()
    {
        TransformMatrix m = new TransformMatrix(1.0, 2.0, 2.0, 4.0);
        assertTrue(Math.abs(m.determinant()) < TransformMatrix.SINGULARITY_THRESHOLD);

        PixelCoordinate p = m.inverseTransform(1.0, 1.0, new PixelScale(0.5, 0.25));

        assertEquals(2.0, p.x(), 1e-12);
        assertEquals(4.0, p.y(), 1e-12);
    }

    @Test
    void effectiveScaleIsRootOfDeterminant()
    {
        TransformMatrix m = TransformMatrix.fromCdelt(-0.0003, 0.0003, 33.0);

        assertEquals(0.0003, m.effectivePixelScale(), 1e-12);
        assertEquals(-9.0e-8, m.determinant(), 1e-18);
    }

    @Test
    void rotationIsRecoveredFromMatrix()
    {
        assertEquals(33.0, TransformMatrix.fromCdelt(0.0003, 0.0003, 33.0).rotationDegrees(), 1e-9);
    }

    @Test
    void pcMatrixIsScaledByCdelt()
    {
        TransformMatrix m = TransformMatrix.fromPc(2.0, 3.0, 1.0, 0.5, 0.25, 1.0);

        assertEquals(new TransformMatrix(2.0, 1.0, 0.75, 3.0), m);
    }
}
