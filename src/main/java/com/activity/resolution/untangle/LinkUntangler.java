package com.activity.resolution.untangle;

import com.activity.resolution.core.model.NativeIdRef;
import com.activity.resolution.core.model.SecondaryAnnotation;
import com.activity.resolution.core.model.SourceKind;
import com.activity.resolution.core.model.SourceLink;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Chooses which annotation stays linked to an activity referenced by several.
 * Pure decision logic; {@link UntangleService} applies the result.
 *
 * <ol>
 *   <li>exactly one annotation names a linked source: keep it</li>
 *   <li>else the first kind, in GPS then desktop order, with exactly one match</li>
 *   <li>else the first kind with several matches, smallest native id</li>
 *   <li>else no match: kind order GPS, desktop, unknown, then smallest native id</li>
 * </ol>
 */
public class LinkUntangler {

    private static final List<SourceKind> MATCH_PREFERENCE = List.of(SourceKind.GPS, SourceKind.DESKTOP);

    private static final Comparator<NativeIdRef> FALLBACK_ORDER = Comparator
            .comparing(NativeIdRef::kind)
            .thenComparing(NativeIdRef::nativeId);

    /**
     * @return empty when the activity has fewer than two annotations
     */
    public Optional<UntangleRecommendation> decide(long activityId, List<SecondaryAnnotation> annotations,
                                                   List<SourceLink> links) {
        if (annotations.size() < 2) {
            return Optional.empty();
        }
        List<NativeIdRef> refs = annotations.stream().map(SecondaryAnnotation::reference).toList();
        List<NativeIdRef> matching = refs.stream().filter(ref -> matchesAny(ref, links)).toList();

        NativeIdRef keep;
        UntangleReason reason;
        if (matching.size() == 1) {
            keep = matching.get(0);
            reason = UntangleReason.SINGLE_SOURCE_MATCH;
        } else if (!matching.isEmpty()) {
            Choice choice = chooseAmongMatches(matching);
            keep = choice.ref();
            reason = choice.reason();
        } else {
            keep = refs.stream().min(FALLBACK_ORDER).orElseThrow();
            reason = UntangleReason.NO_SOURCE_MATCH;
        }

        List<String> unlink = new ArrayList<>();
        for (NativeIdRef ref : refs) {
            if (!ref.nativeId().equals(keep.nativeId())) {
                unlink.add(ref.nativeId());
            }
        }
        unlink.sort(null);
        return Optional.of(new UntangleRecommendation(activityId, keep.nativeId(), unlink, reason));
    }

    private Choice chooseAmongMatches(List<NativeIdRef> matching) {
        for (SourceKind kind : MATCH_PREFERENCE) {
            List<NativeIdRef> ofKind = ofKind(matching, kind);
            if (ofKind.size() == 1) {
                return new Choice(ofKind.get(0), UntangleReason.PREFERRED_KIND_MATCH);
            }
        }
        for (SourceKind kind : MATCH_PREFERENCE) {
            List<NativeIdRef> ofKind = ofKind(matching, kind);
            if (ofKind.size() > 1) {
                NativeIdRef lowest = ofKind.stream().min(Comparator.comparing(NativeIdRef::nativeId)).orElseThrow();
                return new Choice(lowest, UntangleReason.PREFERRED_KIND_LOWEST_ID);
            }
        }
        throw new IllegalStateException("Matching annotations must have a known kind");
    }

    private static List<NativeIdRef> ofKind(List<NativeIdRef> refs, SourceKind kind) {
        return refs.stream().filter(ref -> ref.kind() == kind).toList();
    }

    private static boolean matchesAny(NativeIdRef ref, List<SourceLink> links) {
        for (SourceLink link : links) {
            if (ref.refersTo(link.sourceSystem(), link.normalizedNativeId())) {
                return true;
            }
        }
        return false;
    }

    private record Choice(NativeIdRef ref, UntangleReason reason) {
    }
}
