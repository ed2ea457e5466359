package com.localedata.assembler.resolve;

import java.util.Collection;
import java.util.List;

import com.localedata.assembler.model.CategoryToken;
import com.localedata.assembler.model.LocaleTag;
import com.localedata.assembler.plan.ResolvedEntry;

/**
 * Resolves a non-hierarchical category family across every target locale at once.
 */
public interface SpecialCategoryResolver {

    /**
     * Whether tokens of this kind are handled by this resolver.
     */
    boolean supports(CategoryToken.Kind kind);

    /**
     * @param tokens requested tokens of the supported kinds, never empty
     * @param locales every configured target locale
     */
    List<ResolvedEntry> resolve(Collection<CategoryToken> tokens, List<LocaleTag> locales);
}
