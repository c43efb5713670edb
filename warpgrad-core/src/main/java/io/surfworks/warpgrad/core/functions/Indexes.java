package io.surfworks.warpgrad.core.functions;

final class Indexes {

    private Indexes() {
    }

    static boolean contains(int[] indexes, int index) {
        for (int i : indexes) {
            if (i == index) {
                return true;
            }
        }
        return false;
    }
}
