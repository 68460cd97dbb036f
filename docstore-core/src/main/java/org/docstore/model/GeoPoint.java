/*
 * GeoPoint.java
 *
 * This source file is part of the Docstore open source project
 *
 * Copyright 2024-2026 the Docstore project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.docstore.model;

import org.docstore.DocumentStoreExceptions;

import javax.annotation.Nonnull;

/**
 * A latitude/longitude pair. Points order by latitude, then longitude.
 */
public final class GeoPoint implements Comparable<GeoPoint> {
    private final double latitude;
    private final double longitude;

    public GeoPoint(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("latitude must be within [-90, 90]",
                    "latitude", latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("longitude must be within [-180, 180]",
                    "longitude", longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public int compareTo(@Nonnull GeoPoint other) {
        int cmp = Double.compare(latitude, other.latitude);
        return cmp != 0 ? cmp : Double.compare(longitude, other.longitude);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoPoint)) {
            return false;
        }
        GeoPoint that = (GeoPoint)o;
        return Double.compare(latitude, that.latitude) == 0 && Double.compare(longitude, that.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return "GeoPoint{" + latitude + ", " + longitude + "}";
    }
}
