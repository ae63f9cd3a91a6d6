/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of DarkTrack
 *
 * DarkTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DarkTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DarkTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package darktrack.image;


public interface ImageMask extends ImageProperties {

    boolean insideMask(int x, int y, int z);
    boolean insideMask(int xy, int z);
    int count();
    static void loop(ImageMask mask, LoopFunction function) {
        for (int z = 0; z<mask.sizeZ(); ++z) {
            for (int y = 0; y<mask.sizeY(); ++y) {
                for (int x = 0; x<mask.sizeX(); ++x) {
                    if (mask.insideMask(x, y, z)) function.loop(x, y, z);
                }
            }
        }
    }

    interface LoopFunction {
        void loop(int x, int y, int z);
    }
}
