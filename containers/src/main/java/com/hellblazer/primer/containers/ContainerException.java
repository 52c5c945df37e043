/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Primer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.primer.containers;

/**
 * Base sealed class for container failures. Every failure is raised before the container is modified, so a caller
 * that catches one of these sees the container exactly as it was before the call.
 */
public sealed class ContainerException extends RuntimeException
    permits IndexOutOfRangeException, CapacityExceededException, EmptyCollectionException {

    public ContainerException(String message) {
        super(message);
    }
}
