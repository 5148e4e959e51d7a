/*
Copyright (c) 2009-2010 Mikko Mononen memon@inside.org
recast4j copyright (c) 2015-2019 Piotr Piastucki piotr@jtilia.org

This software is provided 'as-is', without any express or implied
warranty.  In no event will the authors be held liable for any damages
arising from the use of this software.
Permission is granted to anyone to use this software for any purpose,
including commercial applications, and to alter it and redistribute it
freely, subject to the following restrictions:
1. The origin of this software must not be misrepresented; you must not
 claim that you wrote the original software. If you use this software
 in a product, an acknowledgment in the product documentation would be
 appreciated but is not required.
2. Altered source versions must be plainly marked as such, and must not be
 misrepresented as being the original software.
3. This notice may not be removed or altered from any source distribution.
*/
package org.walkmesh4j;

import org.joml.Vector3f;

/**
 * Helpers for vectors stored in flat float arrays, three components per vertex.
 */
public class Vectors {

    private Vectors() {
    }

    public static void copy(Vector3f out, float[] in, int i) {
        out.set(in[i], in[i + 1], in[i + 2]);
    }

    public static void copy(float[] out, int o, Vector3f in) {
        out[o] = in.x;
        out[o + 1] = in.y;
        out[o + 2] = in.z;
    }

    public static void min(Vector3f out, float[] in, int i) {
        out.x = Math.min(out.x, in[i]);
        out.y = Math.min(out.y, in[i + 1]);
        out.z = Math.min(out.z, in[i + 2]);
    }

    public static void max(Vector3f out, float[] in, int i) {
        out.x = Math.max(out.x, in[i]);
        out.y = Math.max(out.y, in[i + 1]);
        out.z = Math.max(out.z, in[i + 2]);
    }

    /// Squared distance between two vertices of one array.
    public static float distSqr(float[] verts, int a, int b) {
        float dx = verts[b] - verts[a];
        float dy = verts[b + 1] - verts[a + 1];
        float dz = verts[b + 2] - verts[a + 2];
        return dx * dx + dy * dy + dz * dz;
    }

    public static boolean isFinite(Vector3f v) {
        return v != null && v.isFinite();
    }

    public static boolean isFinite2D(float x, float y) {
        return Float.isFinite(x) && Float.isFinite(y);
    }
}
