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
package darktrack.processing;

import darktrack.data_structure.Region;
import darktrack.image.ImageInt;
import darktrack.image.ImageMask;

import java.util.*;

/**
 * Connected component labelling of 2D masks
 * @author Jean Ollion
 */
public class ImageLabeller {
    final ImageInt imLabels;
    final HashMap<Integer, Spot> spots;
    final ImageMask mask;
    public static final int[][] neigh2D8Half = new int[][]{ {1, -1}, {0, -1}, {-1, -1}, {-1, 0} };
    int[][] neigh;

    protected ImageLabeller(ImageMask mask) {
        if (mask.sizeZ()!=1) throw new IllegalArgumentException("Only 2D masks are supported");
        this.mask=mask;
        imLabels = new ImageInt("labels", mask);
        spots = new HashMap<>();
    }

    /**
     * 8-connected components of {@param mask}. Labels start at 1 and follow the raster scan order (y then x) of each component's first pixel.
     * @param mask 2D mask
     * @return components
     */
    public static List<Region> labelImage(ImageMask mask) {
        ImageLabeller il = new ImageLabeller(mask);
        il.neigh= ImageLabeller.neigh2D8Half;
        il.labelSpots();
        return il.getObjects();
    }

    /**
     * 
     * @param regions regions, labelled from 1 in list order in the resulting label map
     * @return label map with background = 0
     */
    public static ImageInt toLabelMap(List<Region> regions, int sizeX, int sizeY) {
        ImageInt res = new ImageInt("labels", sizeX, sizeY, 1);
        for (int i = 0; i<regions.size(); ++i) regions.get(i).draw(res, i+1);
        return res;
    }

    protected List<Region> getObjects() {
        List<Integer> labels = new ArrayList<>(spots.keySet());
        Collections.sort(labels); // the smallest label of a fused spot is the one of its first pixel in raster order
        List<Region> res = new ArrayList<>(labels.size());
        int label = 0;
        for (Integer l : labels) res.add(spots.get(l).toRegion(++label));
        return res;
    }
    
    private void labelSpots() {
        int currentLabel = 1;
        int sizeX = mask.sizeX();
        int sizeY = mask.sizeY();
        for (int y = 0; y < sizeY; ++y) {
            for (int x = 0; x < sizeX; ++x) {
                if (!mask.insideMask(x, y, 0)) continue;
                int coord = x + y * sizeX;
                Spot currentSpot = null;
                for (int[] t : neigh) {
                    int xx = x+t[0];
                    int yy = y+t[1];
                    if (xx>=0 && xx<sizeX && yy>=0) {
                        int nextLabel = imLabels.getPixelInt(xx, yy, 0);
                        if (nextLabel != 0) {
                            if (currentSpot == null) {
                                currentSpot = spots.get(nextLabel);
                                currentSpot.addVox(coord);
                            } else if (nextLabel != currentSpot.label) {
                                currentSpot = currentSpot.fusion(spots.get(nextLabel));
                            }
                        }
                    }
                }
                if (currentSpot == null) {
                    spots.put(currentLabel, new Spot(currentLabel++, coord));
                }
            }
        }
    }

    class Spot {
        List<Integer> voxels;
        int label;

        Spot(int label, int coord) {
            this.label = label;
            this.voxels = new ArrayList<>();
            addVox(coord);
        }

        void addVox(int c) {
            voxels.add(c);
            imLabels.setPixel(c, 0, label);
        }

        void setLabel(int label) {
            this.label = label;
            for (int c : voxels) imLabels.setPixel(c, 0, label);
        }

        Spot fusion(Spot other) {
            if (other.label < label) {
                return other.fusion(this);
            }
            spots.remove(other.label);
            other.setLabel(label);
            voxels.addAll(other.voxels);
            return this;
        }

        Region toRegion(int label) {
            return new Region(label, voxels.stream().mapToInt(Integer::intValue).toArray(), mask.sizeX(), mask.sizeY());
        }
    }
}
